package com.ryuqq.chatcommand.core.convert;

import com.ryuqq.chatcommand.core.context.CommandContext;
import com.ryuqq.chatcommand.core.exception.BadArgument;
import com.ryuqq.chatcommand.core.fixture.TestContexts;
import com.ryuqq.chatcommand.core.spi.EntityResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * EntityConverter 테스트.
 *
 * @author ChatCommand Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EntityConverterTest {

    @Mock
    private EntityResolver<String> resolver;

    private final CommandContext context = TestContexts.context();

    @Test
    void convert_앞의_골뱅이를_제거하고_조회() throws Exception {
        // given
        when(resolver.resolve(any(), eq("alice"))).thenReturn(Optional.of("user:alice"));
        EntityConverter<String> converter = new EntityConverter<>("User", resolver);

        // when
        String result = converter.convert(context, "@alice");

        // then
        assertThat(result).isEqualTo("user:alice");
        verify(resolver).resolve(context, "alice");
    }

    @Test
    void convert_조회_결과가_없으면_not_found() throws Exception {
        when(resolver.resolve(any(), eq("ghost"))).thenReturn(Optional.empty());
        EntityConverter<String> converter = new EntityConverter<>("User", resolver);

        assertThatThrownBy(() -> converter.convert(context, "ghost"))
            .isInstanceOf(BadArgument.class)
            .hasMessage("User \"ghost\" was not found.");
    }

    @Test
    void convert_조회_예외는_원인을_보존한_BadArgument() throws Exception {
        IllegalStateException failure = new IllegalStateException("api down");
        when(resolver.resolve(any(), eq("alice"))).thenThrow(failure);
        EntityConverter<String> converter = new EntityConverter<>("User", resolver);

        assertThatThrownBy(() -> converter.convert(context, "alice"))
            .isInstanceOf(BadArgument.class)
            .hasCause(failure);
    }

    @Test
    void convert_빈_이름은_조회하지_않고_실패() {
        EntityConverter<String> converter = new EntityConverter<>("User", resolver);

        assertThatThrownBy(() -> converter.convert(context, "@"))
            .isInstanceOf(BadArgument.class);
        verifyNoInteractions(resolver);
    }
}
