package com.ryuqq.chatcommand.core.guard;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.CheckFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * 순서가 있는 Guard 목록.
 *
 * <p>빌드 시점에 (컴포넌트 → 상위 그룹 → 명령) 순으로 이어 붙여 만들어지며,
 * Dispatcher의 전역 Guard는 그 앞에 붙습니다.</p>
 *
 * <p><strong>평가 규칙:</strong></p>
 * <ul>
 *   <li>선언 순서대로 평가, 첫 번째 거부에서 중단</li>
 *   <li>false 반환 → {@link CheckFailure} (Guard 이름 + 메시지)</li>
 *   <li>{@link CheckFailure} 발생 → 그대로 전파</li>
 *   <li>그 외 예외 → 원인을 보존한 {@link CheckFailure}</li>
 *   <li>{@link InterruptedException} → 그대로 전파 (취소)</li>
 * </ul>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class GuardChain {

    private static final GuardChain EMPTY = new GuardChain(List.of());

    private final List<Guard> guards;

    private GuardChain(List<Guard> guards) {
        this.guards = List.copyOf(guards);
    }

    public static GuardChain empty() {
        return EMPTY;
    }

    /**
     * @param guards 평가 순서대로 정렬된 Guard
     * @return GuardChain
     * @throws IllegalArgumentException guards가 null이거나 null을 포함하는 경우
     */
    public static GuardChain of(List<Guard> guards) {
        if (guards == null) {
            throw new IllegalArgumentException("guards cannot be null");
        }
        for (Guard guard : guards) {
            if (guard == null) {
                throw new IllegalArgumentException("guards cannot contain null");
            }
        }
        return guards.isEmpty() ? EMPTY : new GuardChain(guards);
    }

    /**
     * 두 체인을 이어 붙임 (this 먼저).
     *
     * @param after 뒤에 평가할 체인
     * @return 새 체인
     */
    public GuardChain then(GuardChain after) {
        if (after.guards.isEmpty()) {
            return this;
        }
        if (guards.isEmpty()) {
            return after;
        }
        List<Guard> joined = new ArrayList<>(guards.size() + after.guards.size());
        joined.addAll(guards);
        joined.addAll(after.guards);
        return new GuardChain(joined);
    }

    /**
     * 모든 Guard 평가.
     *
     * @param context 현재 호출 컨텍스트
     * @throws CheckFailure 거부된 경우
     * @throws InterruptedException 평가 중 인터럽트된 경우
     */
    public void check(CommandContext context) throws InterruptedException {
        for (Guard guard : guards) {
            boolean allowed;
            try {
                allowed = guard.test(context);
            } catch (InterruptedException e) {
                throw e;
            } catch (CheckFailure e) {
                throw e;
            } catch (Exception e) {
                throw new CheckFailure(guard.name(),
                    "The check \"" + guard.name() + "\" raised an error: " + e.getMessage(), e);
            }
            if (!allowed) {
                throw new CheckFailure(guard.name(), guard.failureMessage());
            }
        }
    }

    public List<Guard> guards() {
        return guards;
    }

    public boolean isEmpty() {
        return guards.isEmpty();
    }

    public int size() {
        return guards.size();
    }
}
