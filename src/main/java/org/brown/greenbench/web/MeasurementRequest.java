package org.brown.greenbench.web;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * POST /measurements 요청 본문
 */
@Data
public class MeasurementRequest {

    @NotBlank
    private String instanceId;

    @NotBlank
    private String variantId;

    @NotBlank
    private String testName;

    /**
     * bash -c 로 실행할 명령
     */
    @NotBlank
    private String command;

    private String workingDir;

    /**
     * 지정하면 해당 컨테이너 안에서 docker exec 로 실행
     */
    private String containerId;

    /**
     * 미지정 시 measurement.workload.default-timeout-seconds
     */
    @Min(1)
    private Long timeoutSeconds;

    /**
     * 에너지 효율 계산용 작업량 (예: 통과한 테스트 수)
     */
    @PositiveOrZero
    private Long usefulWork;
}
