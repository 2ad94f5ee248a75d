package service;

/**
 * 저장소가 만료 판단에 사용하는 현재 시각 (epoch 기준 밀리초)
 */
@FunctionalInterface
public interface TimeSource {

    TimeSource SYSTEM = System::currentTimeMillis;

    long currentTimeMillis();
}
