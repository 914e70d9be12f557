package com.ryuqq.chatcommand.core.cooldown;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.CommandOnCooldown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 명령 하나의 cooldown 상태 관리.
 *
 * <p>명령이 살아 있는 동안 유지되는 유일한 가변 상태입니다.
 * 키는 (cooldown 인덱스, Bucket 키) 쌍입니다.</p>
 *
 * <p><strong>원자성:</strong></p>
 * <ul>
 *   <li>읽기 → 평가 → 커밋은 하나의 lock 안에서 수행 (동시 호출의 이중 허용 없음)</li>
 *   <li>모든 cooldown이 허용할 때만 커밋 (부분 차감 없음)</li>
 *   <li>거부 시 가장 긴 retryAfter로 {@link CommandOnCooldown}</li>
 * </ul>
 *
 * <p><strong>정리:</strong> 마지막 정리 후 {@code sweepIntervalMs}가 지나면
 * 다음 호출에서 오래된 상태({@link Cooldown#isStale})를 제거합니다.</p>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class CooldownManager {

    private static final Logger log = LoggerFactory.getLogger(CooldownManager.class);

    private final String commandName;
    private final List<CooldownSpec> specs;
    private final Duration sweepInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Slot, CooldownState> states = new HashMap<>();
    private Instant lastSweep;

    /**
     * @param commandName 소유 명령 이름 (오류 메시지용)
     * @param specs 선언 순서대로의 cooldown
     * @param config 설정
     */
    public CooldownManager(String commandName, List<CooldownSpec> specs, CooldownManagerConfig config) {
        if (commandName == null || commandName.isBlank()) {
            throw new IllegalArgumentException("commandName cannot be null or blank");
        }
        if (specs == null) {
            throw new IllegalArgumentException("specs cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.commandName = commandName;
        this.specs = List.copyOf(specs);
        this.sweepInterval = Duration.ofMillis(config.sweepIntervalMs());
    }

    /**
     * 모든 cooldown을 평가하고, 전부 허용이면 상태를 커밋.
     *
     * @param context 현재 호출 컨텍스트 (Bucket 키 추출용)
     * @param now 현재 시각
     * @throws CommandOnCooldown 하나라도 거부한 경우 (상태 변경 없음)
     */
    public void acquire(CommandContext context, Instant now) {
        if (specs.isEmpty()) {
            return;
        }
        List<Slot> slots = slotsFor(context);

        lock.lock();
        try {
            sweepIfDue(now);

            List<CooldownState> pending = new ArrayList<>(slots.size());
            Duration longestWait = null;
            for (Slot slot : slots) {
                if (slot == null) {
                    pending.add(null);
                    continue;
                }
                CooldownDecision decision = specs.get(slot.index()).cooldown().evaluate(states.get(slot), now);
                if (decision.allowed()) {
                    pending.add(decision.next());
                } else if (longestWait == null || decision.retryAfter().compareTo(longestWait) > 0) {
                    longestWait = decision.retryAfter();
                }
            }

            if (longestWait != null) {
                log.debug("Command {} on cooldown, retry after {}", commandName, longestWait);
                throw new CommandOnCooldown(commandName, longestWait);
            }

            for (int i = 0; i < slots.size(); i++) {
                Slot slot = slots.get(i);
                if (slot != null) {
                    states.put(slot, pending.get(i));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 상태를 변경하지 않고 대기 시간 확인.
     *
     * @param context 현재 호출 컨텍스트
     * @param now 현재 시각
     * @return 거부될 경우 가장 긴 retryAfter, 허용될 경우 empty
     */
    public Optional<Duration> peek(CommandContext context, Instant now) {
        List<Slot> slots = slotsFor(context);
        lock.lock();
        try {
            Duration longestWait = null;
            for (Slot slot : slots) {
                if (slot == null) {
                    continue;
                }
                CooldownDecision decision = specs.get(slot.index()).cooldown().evaluate(states.get(slot), now);
                if (!decision.allowed() && (longestWait == null || decision.retryAfter().compareTo(longestWait) > 0)) {
                    longestWait = decision.retryAfter();
                }
            }
            return Optional.ofNullable(longestWait);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRateLimited(CommandContext context, Instant now) {
        return peek(context, now).isPresent();
    }

    /**
     * 모든 상태 초기화.
     */
    public void reset() {
        lock.lock();
        try {
            states.clear();
            lastSweep = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 보관 중인 상태 수.
     *
     * @return (cooldown, 키) 쌍의 수
     */
    public int trackedKeys() {
        lock.lock();
        try {
            return states.size();
        } finally {
            lock.unlock();
        }
    }

    public List<CooldownSpec> specs() {
        return specs;
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    private List<Slot> slotsFor(CommandContext context) {
        List<Slot> slots = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            Object key = specs.get(i).bucket().key(context);
            slots.add(key == null ? null : new Slot(i, key));
        }
        return slots;
    }

    // lock 보유 상태에서만 호출
    private void sweepIfDue(Instant now) {
        if (lastSweep != null && now.isBefore(lastSweep.plus(sweepInterval))) {
            return;
        }
        lastSweep = now;
        int removed = 0;
        Iterator<Map.Entry<Slot, CooldownState>> iterator = states.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Slot, CooldownState> entry = iterator.next();
            if (specs.get(entry.getKey().index()).cooldown().isStale(entry.getValue(), now)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Cooldown sweep for {} removed {} stale entries", commandName, removed);
        }
    }

    private record Slot(int index, Object key) {
    }
}
