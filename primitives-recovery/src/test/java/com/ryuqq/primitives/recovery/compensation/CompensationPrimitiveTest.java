package com.ryuqq.primitives.recovery.compensation;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.Primitives;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ConfigurationException;
import com.ryuqq.primitives.testkit.RecordingInstrumentationSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CompensationPrimitive 유닛 테스트.
 *
 * <p>주문 흐름(재고 예약 → 결제 → 배송)을 예로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("CompensationPrimitive 테스트")
class CompensationPrimitiveTest {

    private List<String> journal;
    private Primitive<String, String> reserve;
    private Primitive<String, Integer> charge;
    private Compensator<String, String> release;
    private Compensator<String, Integer> refund;

    @BeforeEach
    void setUp() {
        journal = new CopyOnWriteArrayList<>();
        reserve = Primitives.lambda("reserve", (order, ctx) -> {
            journal.add("reserve:" + order);
            return "reservation-" + order;
        });
        charge = Primitives.lambda("charge", (reservation, ctx) -> {
            journal.add("charge:" + reservation);
            return 100;
        });
        release = (order, reservation, ctx) -> journal.add("release:" + reservation);
        refund = (reservation, amount, ctx) -> journal.add("refund:" + amount);
    }

    @Test
    @DisplayName("모든 단계가 성공하면 마지막 단계의 결과를 반환하고 보상하지 않는다")
    void 전체_성공() throws Exception {
        // given
        Primitive<Integer, String> ship = Primitives.lambda("ship", (amount, ctx) -> "shipped:" + amount);
        CompensationPrimitive<String, String> saga = CompensationPrimitive.<String>builder()
            .name("order")
            .step("reserve", reserve, release)
            .step("charge", charge, refund)
            .step("ship", ship)
            .build();
        Context context = Context.create();

        // when
        String result = saga.execute("o-1", context);

        // then
        assertThat(result).isEqualTo("shipped:100");
        assertThat(journal).containsExactly("reserve:o-1", "charge:reservation-o-1");
        assertThat(context.state()).doesNotContainKey(CompensationPrimitive.REPORT_KEY);
        assertThat(saga.stepNames()).containsExactly("reserve", "charge", "ship");
    }

    @Test
    @DisplayName("단계가 실패하면 완료된 단계를 역순으로 보상하고 원래 예외를 던진다")
    void 역순_보상() {
        // given
        Primitive<Integer, String> ship = Primitives.lambda("ship", (amount, ctx) -> {
            throw new IOException("carrier down");
        });
        RecordingInstrumentationSink sink = new RecordingInstrumentationSink();
        CompensationPrimitive<String, String> saga = CompensationPrimitive.<String>builder()
            .sink(sink)
            .step("reserve", reserve, release)
            .step("charge", charge, refund)
            .step("ship", ship)
            .build();
        Context context = Context.create();

        // when & then
        assertThatThrownBy(() -> saga.execute("o-1", context))
            .isInstanceOf(IOException.class)
            .hasMessage("carrier down");
        assertThat(journal).containsExactly(
            "reserve:o-1", "charge:reservation-o-1", "refund:100", "release:reservation-o-1"
        );

        CompensationReport report = context.stateValue(CompensationPrimitive.REPORT_KEY, CompensationReport.class)
            .orElseThrow();
        assertThat(report.failedStep()).isEqualTo("ship");
        assertThat(report.compensated()).containsExactly("charge", "reserve");
        assertThat(report.fullyCompensated()).isTrue();
        assertThat(sink.events("compensation.started")).hasSize(1);
    }

    @Test
    @DisplayName("보상 실패는 기록만 하고 나머지 보상을 계속 진행한다")
    void 보상_실패_기록() {
        // given
        Compensator<String, Integer> brokenRefund = (reservation, amount, ctx) -> {
            throw new IllegalStateException("refund api down");
        };
        Primitive<Integer, String> ship = Primitives.lambda("ship", (amount, ctx) -> {
            throw new IOException("carrier down");
        });
        CompensationPrimitive<String, String> saga = CompensationPrimitive.<String>builder()
            .step("reserve", reserve, release)
            .step("charge", charge, brokenRefund)
            .step("ship", ship)
            .build();
        Context context = Context.create();

        // when & then
        assertThatThrownBy(() -> saga.execute("o-1", context)).isInstanceOf(IOException.class);
        CompensationReport report = context.stateValue(CompensationPrimitive.REPORT_KEY, CompensationReport.class)
            .orElseThrow();
        assertThat(report.compensated()).containsExactly("reserve");
        assertThat(report.failures())
            .extracting(CompensationReport.CompensationFailure::step)
            .containsExactly("charge");
        assertThat(report.fullyCompensated()).isFalse();
        assertThat(journal).contains("release:reservation-o-1");
    }

    @Test
    @DisplayName("첫 단계가 실패하면 보상할 단계가 없다")
    void 첫_단계_실패() {
        // given
        Primitive<String, String> failingReserve = Primitives.lambda("reserve", (order, ctx) -> {
            throw new IOException("out of stock");
        });
        CompensationPrimitive<String, Integer> saga = CompensationPrimitive.<String>builder()
            .step("reserve", failingReserve, release)
            .step("charge", charge, refund)
            .build();
        Context context = Context.create();

        // when & then
        assertThatThrownBy(() -> saga.execute("o-1", context)).isInstanceOf(IOException.class);
        CompensationReport report = context.stateValue(CompensationPrimitive.REPORT_KEY, CompensationReport.class)
            .orElseThrow();
        assertThat(report.compensated()).isEmpty();
        assertThat(journal).isEmpty();
    }

    @Test
    @DisplayName("같은 Builder에서 갈라 만든 두 흐름은 서로의 단계를 공유하지 않는다")
    void Builder_분기() throws Exception {
        // given
        CompensationPrimitive.Builder<String, String> base = CompensationPrimitive.<String>builder()
            .step("a", Primitives.<String, String>lambda("a", (in, ctx) -> in + "-a"));
        CompensationPrimitive.Builder<String, String> withB =
            base.step("b", Primitives.<String, String>lambda("b", (in, ctx) -> in + "-b"));
        CompensationPrimitive.Builder<String, Integer> withLength =
            base.step("length", Primitives.<String, Integer>lambda("length", (in, ctx) -> in.length()));

        // when
        String first = withB.build().execute("x", Context.create());
        Integer second = withLength.build().execute("x", Context.create());

        // then
        assertThat(first).isEqualTo("x-a-b");
        assertThat(second).isEqualTo(3);
        assertThat(base.build().stepNames()).containsExactly("a");
        assertThat(withB.build().stepNames()).containsExactly("a", "b");
        assertThat(withLength.build().stepNames()).containsExactly("a", "length");
    }

    @Test
    @DisplayName("보상 작업이 Error를 던져도 기록하고 나머지 보상을 계속 진행한다")
    void 보상_Error_기록() {
        // given
        Compensator<String, Integer> crashingRefund = (reservation, amount, ctx) -> {
            throw new AssertionError("refund crashed");
        };
        Primitive<Integer, String> ship = Primitives.lambda("ship", (amount, ctx) -> {
            throw new IOException("carrier down");
        });
        CompensationPrimitive<String, String> saga = CompensationPrimitive.<String>builder()
            .step("reserve", reserve, release)
            .step("charge", charge, crashingRefund)
            .step("ship", ship)
            .build();
        Context context = Context.create();

        // when & then
        assertThatThrownBy(() -> saga.execute("o-1", context))
            .isInstanceOf(IOException.class)
            .hasMessage("carrier down");
        CompensationReport report = context.stateValue(CompensationPrimitive.REPORT_KEY, CompensationReport.class)
            .orElseThrow();
        assertThat(report.compensated()).containsExactly("reserve");
        assertThat(report.failures())
            .extracting(CompensationReport.CompensationFailure::error)
            .singleElement()
            .isInstanceOf(AssertionError.class);
        assertThat(journal).contains("release:reservation-o-1");
    }

    @Test
    @DisplayName("단계가 없으면 ConfigurationException")
    void 단계_없음() {
        assertThatThrownBy(() -> CompensationPrimitive.<String>builder().build())
            .isInstanceOf(ConfigurationException.class);
    }
}
