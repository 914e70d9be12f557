package com.ryuqq.chatcommand.core.convert;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.ConversionError;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 여러 변환기를 선언 순서대로 시도하는 변환기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>변형(variant)을 선언 순서대로 시도</li>
 *   <li>첫 번째로 성공한 값을 반환</li>
 *   <li>모두 실패하면:
 *     <ul>
 *       <li>optional: null 반환 ("값 없음" 변형)</li>
 *       <li>그 외: 각 실패 사유를 모은 {@link ConversionError}</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
public final class UnionConverter implements Converter<Object> {

    private final List<Converter<?>> variants;
    private final boolean optional;

    public UnionConverter(List<Converter<?>> variants, boolean optional) {
        if (variants == null || variants.isEmpty()) {
            throw new IllegalArgumentException("variants cannot be null or empty");
        }
        this.variants = List.copyOf(variants);
        this.optional = optional;
    }

    @Override
    public Object convert(CommandContext context, String raw) throws Exception {
        List<String> reasons = new ArrayList<>(variants.size());
        for (Converter<?> variant : variants) {
            try {
                Object value = variant.convert(context, raw);
                if (value != null) {
                    return value;
                }
                reasons.add(variant.describe() + ": no value");
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                reasons.add(variant.describe() + ": " + e.getMessage());
            }
        }
        if (optional) {
            return null;
        }
        throw new ConversionError(raw, reasons);
    }

    public boolean isOptional() {
        return optional;
    }

    public List<Converter<?>> getVariants() {
        return variants;
    }

    @Override
    public String describe() {
        String joined = variants.stream().map(Converter::describe).collect(Collectors.joining(" | "));
        return optional ? joined + " | None" : joined;
    }
}
