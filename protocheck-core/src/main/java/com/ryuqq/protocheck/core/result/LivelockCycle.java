package com.ryuqq.protocheck.core.result;

import java.util.List;

/**
 * 라이브락 후보: 닫힌(closed) SCC.
 *
 * <p>SCC의 모든 간선이 내부에 머무르고, 상태가 2개 이상이거나 자기 루프를 가지며,
 * 최종 상태를 포함하지 않는 경우입니다. 한 번 진입하면 빠져나오거나 종료할 수 없습니다.</p>
 *
 * @param states SCC 구성 상태
 * @param reachable 초기 상태에서 SCC의 상태 중 하나라도 도달 가능한지 여부
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record LivelockCycle(
    List<String> states,
    boolean reachable
) {

    public LivelockCycle {
        if (states == null || states.isEmpty()) {
            throw new IllegalArgumentException("states cannot be null or empty");
        }
        states = List.copyOf(states);
    }

    public boolean contains(String state) {
        return states.contains(state);
    }
}
