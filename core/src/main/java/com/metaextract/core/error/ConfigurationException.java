package com.metaextract.core.error;

/**
 * 설정 오류.
 * - 기법 식별자를 해석할 수 없을 때(어떤 기법도 실행되기 전에 호출 전체 중단)
 * - 설정 값 자체가 잘못되었을 때(빈 식별자, 잘못된 YAML 구조 등)
 */
public class ConfigurationException extends ExtractionException {

    private final String identifier; // 문제가 된 기법 식별자, 없으면 null

    public ConfigurationException(String message) {
        this(message, null, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    private ConfigurationException(String message, String identifier, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
    }

    public static ConfigurationException unknownTechnique(String identifier) {
        return new ConfigurationException("unknown technique: '" + identifier + "'", identifier, null);
    }

    public static ConfigurationException brokenFactory(String identifier) {
        return new ConfigurationException("technique factory returned null: '" + identifier + "'", identifier, null);
    }

    /** 해석에 실패한 기법 식별자 (식별자와 무관한 설정 오류면 null) */
    public String getIdentifier() {
        return identifier;
    }
}
