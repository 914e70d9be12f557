package com.ryuqq.chatcommand.core.exception;

/**
 * 변환기가 입력 값을 거부함.
 *
 * <p>변환기는 파라미터 이름을 모른 채 이 예외를 던질 수 있습니다.
 * 바인더가 {@link #forParameter(String)}로 파라미터 이름이 채워진 사본을 만듭니다.
 * 예외 인스턴스 자체는 불변이므로 변환기가 같은 인스턴스를 다시 던져도 안전합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public class BadArgument extends CommandException {

    private final String value;
    private final String parameterName;

    public BadArgument(String message, String value) {
        super(message);
        this.value = value;
        this.parameterName = null;
    }

    public BadArgument(String message, String value, Throwable cause) {
        this(message, value, null, cause);
    }

    public BadArgument(String message, String value, String parameterName, Throwable cause) {
        super(message, cause);
        this.value = value;
        this.parameterName = parameterName;
    }

    /**
     * 파라미터 이름이 지정된 사본 생성 (원본의 메시지, 값, 원인, 스택 트레이스 유지).
     *
     * @param source 원본 예외
     * @param parameterName 파라미터 이름
     */
    protected BadArgument(BadArgument source, String parameterName) {
        super(source.getMessage(), source.getCause());
        this.value = source.value;
        this.parameterName = parameterName;
        setStackTrace(source.getStackTrace());
    }

    /**
     * 실패한 파라미터 이름 지정.
     *
     * <p>이미 지정되어 있으면 this를, 아니면 이름이 채워진 새 인스턴스를 반환합니다.</p>
     *
     * @param parameterName 파라미터 이름
     * @return 파라미터 이름이 지정된 BadArgument
     */
    public BadArgument forParameter(String parameterName) {
        if (this.parameterName != null) {
            return this;
        }
        return withParameterName(parameterName);
    }

    /**
     * 파라미터 이름이 지정된 사본 생성. 하위 타입은 자기 타입을 유지하도록 재정의합니다.
     */
    protected BadArgument withParameterName(String parameterName) {
        return new BadArgument(this, parameterName);
    }

    /**
     * 변환에 실패한 원본 값.
     *
     * @return 원본 문자열 (null 가능)
     */
    public String getValue() {
        return value;
    }

    /**
     * 실패한 파라미터 이름.
     *
     * @return 파라미터 이름 또는 null (바인딩 전)
     */
    public String getParameterName() {
        return parameterName;
    }
}
