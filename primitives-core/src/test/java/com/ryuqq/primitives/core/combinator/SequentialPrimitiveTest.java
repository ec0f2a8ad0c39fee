package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.Primitives;
import com.ryuqq.primitives.core.context.Checkpoint;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SequentialPrimitive 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("SequentialPrimitive 테스트")
class SequentialPrimitiveTest {

    private final Primitive<String, Integer> parse = Primitives.function("parse", Integer::parseInt);
    private final Primitive<Integer, Integer> twice = Primitives.function("twice", n -> n * 2);
    private final Primitive<Integer, String> format = Primitives.function("format", n -> "n=" + n);

    @Test
    @DisplayName("parse 후 두 배를 하면 \"21\"은 42가 된다")
    void 문자열_21은_42() throws Exception {
        // given
        Primitive<String, Integer> pipeline = parse.then(twice);

        // when
        Integer result = pipeline.execute("21", Context.create());

        // then
        assertThat(result).isEqualTo(42);
    }

    @Test
    @DisplayName("결합 순서와 무관하게 같은 결과와 같은 단계 목록을 가진다")
    void 결합법칙() throws Exception {
        // given
        Primitive<String, String> left = parse.then(twice).then(format);
        Primitive<String, String> right = parse.then(twice.then(format));

        // when
        String leftResult = left.execute("21", Context.create());
        String rightResult = right.execute("21", Context.create());

        // then
        assertThat(leftResult).isEqualTo(rightResult).isEqualTo("n=42");
        assertThat(((SequentialPrimitive<?, ?>) left).steps())
            .containsExactlyElementsOf(((SequentialPrimitive<?, ?>) right).steps());
        assertThat(((SequentialPrimitive<?, ?>) left).steps()).hasSize(3);
    }

    @Test
    @DisplayName("단계는 왼쪽에서 오른쪽 순서로 실행된다")
    void 실행_순서() throws Exception {
        // given
        List<String> calls = new CopyOnWriteArrayList<>();
        Primitive<String, String> a = Primitives.lambda("a", (in, ctx) -> { calls.add("a"); return in + "a"; });
        Primitive<String, String> b = Primitives.lambda("b", (in, ctx) -> { calls.add("b"); return in + "b"; });
        Primitive<String, String> c = Primitives.lambda("c", (in, ctx) -> { calls.add("c"); return in + "c"; });

        // when
        String result = Primitives.<String, String>sequenceOf(List.of(a, b, c)).execute("", Context.create());

        // then
        assertThat(result).isEqualTo("abc");
        assertThat(calls).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("첫 실패에서 중단하고 원래 예외를 그대로 전파한다")
    void 첫_실패에서_중단() {
        // given
        List<String> calls = new CopyOnWriteArrayList<>();
        Primitive<String, String> ok = Primitives.lambda("ok", (in, ctx) -> { calls.add("ok"); return in; });
        Primitive<String, String> boom = Primitives.lambda("boom", (in, ctx) -> { throw new IOException("disk"); });
        Primitive<String, String> never = Primitives.lambda("never", (in, ctx) -> { calls.add("never"); return in; });
        Primitive<String, String> pipeline = ok.then(boom).then(never);

        // when & then
        assertThatThrownBy(() -> pipeline.execute("x", Context.create()))
            .isInstanceOf(IOException.class)
            .hasMessage("disk");
        assertThat(calls).containsExactly("ok");
    }

    @Test
    @DisplayName("모든 단계가 같은 Context를 공유한다")
    void Context_공유() throws Exception {
        // given
        Primitive<String, String> writer = Primitives.lambda("writer", (in, ctx) -> {
            ctx.state().put("seen", in);
            return in.toUpperCase();
        });
        Primitive<String, String> reader = Primitives.lambda("reader", (in, ctx) -> in + ":" + ctx.state().get("seen"));
        Context context = Context.create();

        // when
        String result = writer.then(reader).execute("hello", context);

        // then
        assertThat(result).isEqualTo("HELLO:hello");
        assertThat(context.state()).containsEntry("seen", "hello");
    }

    @Test
    @DisplayName("단계마다 sequential.step.<i> 체크포인트를 남긴다")
    void 단계별_체크포인트() throws Exception {
        // given
        Context context = Context.create();

        // when
        parse.then(twice).then(format).execute("1", context);

        // then
        assertThat(context.checkpoints())
            .extracting(Checkpoint::name)
            .containsExactly("sequential.step.0", "sequential.step.1", "sequential.step.2");
    }

    @Test
    @DisplayName("단계가 없으면 ConfigurationException")
    void 빈_단계_구성_오류() {
        assertThatThrownBy(() -> new SequentialPrimitive<String, String>(List.of()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("null 단계는 IllegalArgumentException")
    void null_단계() {
        assertThatThrownBy(() -> parse.then(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
