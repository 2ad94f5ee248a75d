package service;

/**
 * 키-값 저장소 인터페이스. 모든 연산은 서로에 대해 원자적이어야 합니다.
 */
public interface StorageService {

    /**
     * 키-값을 저장합니다. 기존 만료 시간은 제거됩니다.
     */
    void set(String key, String value);

    /**
     * 절대 만료 시각(밀리초)과 함께 키-값을 저장합니다.
     */
    void setWithExpiry(String key, String value, long expiresAtMillis);

    /**
     * 키에 해당하는 값을 가져옵니다. 만료된 키는 이 호출에서 삭제되고 null을 반환합니다.
     */
    String get(String key);

    /**
     * 키를 삭제합니다.
     *
     * @return 삭제할 항목이 있었으면 true
     */
    boolean remove(String key);

    /**
     * 저장된 항목 수. 아직 조회되지 않은 만료 항목도 포함됩니다.
     */
    int size();

    /**
     * 만료 계산에 쓰이는 현재 시각
     */
    long now();
}
