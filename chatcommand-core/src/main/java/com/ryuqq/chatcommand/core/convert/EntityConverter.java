package com.ryuqq.chatcommand.core.convert;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.BadArgument;
import com.ryuqq.chatcommand.core.spi.EntityResolver;

import java.util.Optional;

/**
 * 외부 엔티티(사용자, 채널, 클립 등)로 변환하는 클래스형 변환기.
 *
 * <p>조회는 주입된 {@link EntityResolver}에 위임하며, 결과는 불투명한 값으로 취급합니다.
 * 멘션 형태({@code @alice})의 앞 {@code @}는 제거한 뒤 조회합니다.</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>조회 결과 없음 → {@link BadArgument}</li>
 *   <li>Resolver 예외 → 원인을 보존한 {@link BadArgument}</li>
 *   <li>{@link InterruptedException} → 그대로 전파 (취소)</li>
 * </ul>
 *
 * @param <E> 엔티티 타입
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class EntityConverter<E> implements Converter<E> {

    private final String entityName;
    private final EntityResolver<E> resolver;

    public EntityConverter(String entityName, EntityResolver<E> resolver) {
        if (entityName == null || entityName.isBlank()) {
            throw new IllegalArgumentException("entityName cannot be null or blank");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        this.entityName = entityName;
        this.resolver = resolver;
    }

    @Override
    public E convert(CommandContext context, String raw) throws Exception {
        String token = raw.trim();
        if (token.startsWith("@")) {
            token = token.substring(1);
        }
        if (token.isEmpty()) {
            throw new BadArgument(entityName + " name cannot be empty", raw);
        }

        Optional<E> resolved;
        try {
            resolved = resolver.resolve(context, token);
        } catch (InterruptedException e) {
            throw e;
        } catch (BadArgument e) {
            throw e;
        } catch (Exception e) {
            throw new BadArgument("Failed to look up " + entityName + " \"" + token + "\": " + e.getMessage(), raw, e);
        }

        if (resolved == null || resolved.isEmpty()) {
            throw new BadArgument(entityName + " \"" + token + "\" was not found.", raw);
        }
        return resolved.get();
    }

    @Override
    public String describe() {
        return entityName;
    }
}
