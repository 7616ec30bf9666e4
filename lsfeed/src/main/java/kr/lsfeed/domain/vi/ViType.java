package kr.lsfeed.domain.vi;

import java.util.Optional;

/**
 * VI kind as reported in vi_gubun.
 */
public enum ViType {
    RELEASE(0),
    STATIC(1),
    DYNAMIC(2),
    STATIC_AND_DYNAMIC(3);

    private final int code;

    ViType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ViType> fromCode(int code) {
        for (ViType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
