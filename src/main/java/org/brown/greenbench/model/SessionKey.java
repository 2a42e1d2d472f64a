package org.brown.greenbench.model;

/**
 * 측정 세션 식별자: (instance, variant, test)
 */
public record SessionKey(String instanceId, String variantId, String testName) {

    public SessionKey {
        requireText(instanceId, "instanceId");
        requireText(variantId, "variantId");
        requireText(testName, "testName");
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    @Override
    public String toString() {
        return instanceId + "/" + variantId + "/" + testName;
    }
}
