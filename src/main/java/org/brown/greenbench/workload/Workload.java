package org.brown.greenbench.workload;

import java.time.Duration;

/**
 * 측정 대상 작업. 재시도될 수 있으므로 반복 실행해도 안전해야 한다.
 */
@FunctionalInterface
public interface Workload {

    /**
     * @param timeout 호출자가 허용하는 최대 실행 시간
     * @return 실행 결과. 실패도 예외 대신 결과로 돌려줄 수 있다.
     * @throws Exception 실행 자체가 불가능한 경우 (실패로 처리된다)
     */
    WorkloadResult run(Duration timeout) throws Exception;
}
