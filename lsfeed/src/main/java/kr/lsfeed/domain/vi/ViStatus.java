package kr.lsfeed.domain.vi;

public enum ViStatus {
    INACTIVE,
    ACTIVE
}
