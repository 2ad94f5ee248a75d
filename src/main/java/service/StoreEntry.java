package service;

import lombok.Getter;

/**
 * 저장소의 키 하나에 대응하는 값과 만료 시각
 */
@Getter
public final class StoreEntry {

    private final String value;
    // 절대 만료 시각 (밀리초), null이면 만료되지 않음
    private final Long expiresAt;

    public StoreEntry(String value, Long expiresAt) {
        this.value = value;
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(long now) {
        return expiresAt != null && now >= expiresAt;
    }
}
