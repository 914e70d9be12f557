package com.ryuqq.chatcommand.core.cooldown;

import java.time.Duration;

/**
 * 명령에 선언된 cooldown 하나 (Bucket + 알고리즘).
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CooldownSpec.gcra(1, Duration.ofSeconds(10), BucketType.CHATTER);
 * CooldownSpec.fixedWindow(3, Duration.ofMinutes(1), BucketType.CHANNEL);
 * </pre>
 *
 * @param bucket 키 추출 규칙
 * @param cooldown 알고리즘
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public record CooldownSpec(Bucket bucket, Cooldown cooldown) {

    public CooldownSpec {
        if (bucket == null) {
            throw new IllegalArgumentException("bucket cannot be null");
        }
        if (cooldown == null) {
            throw new IllegalArgumentException("cooldown cannot be null");
        }
    }

    public static CooldownSpec fixedWindow(int rate, Duration period, Bucket bucket) {
        return new CooldownSpec(bucket, new FixedWindowCooldown(rate, period));
    }

    public static CooldownSpec gcra(int rate, Duration period, Bucket bucket) {
        return new CooldownSpec(bucket, new GcraCooldown(rate, period));
    }

    public static CooldownSpec gcra(int rate, Duration period, int burst, Bucket bucket) {
        return new CooldownSpec(bucket, new GcraCooldown(rate, period, burst));
    }
}
