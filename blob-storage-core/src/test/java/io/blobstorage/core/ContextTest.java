package io.blobstorage.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextTest {

    @Test
    void rootIsNeverCancelled() {
        assertThat(Context.none().isCancelled()).isFalse();
        assertThat(Context.none().deadline()).isNull();
        assertThatThrownBy(() -> Context.none().cancel()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void cancellingAParentCancelsChildren() {
        Context parent = Context.none().withCancellation();
        Context child = parent.withTimeout(Duration.ofHours(1));

        parent.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThatThrownBy(child::throwIfCancelled)
                .isInstanceOf(OperationCancelledException.class)
                .satisfies(e -> assertThat(((OperationCancelledException) e).deadlineExceeded()).isFalse());
    }

    @Test
    void cancellingAChildLeavesTheParentAlone() {
        Context parent = Context.none().withCancellation();
        Context child = parent.withCancellation();

        child.cancel();

        assertThat(parent.isCancelled()).isFalse();
        assertThat(child.isCancelled()).isTrue();
    }

    @Test
    void expiredDeadlineCancels() {
        Clock fixed = Clock.fixed(Instant.parse("2024-01-01T00:00:10Z"), ZoneOffset.UTC);
        Context ctx = Context.none().withClock(fixed).withDeadline(Instant.parse("2024-01-01T00:00:05Z"));

        assertThat(ctx.isCancelled()).isTrue();
        assertThatThrownBy(ctx::throwIfCancelled)
                .isInstanceOf(OperationCancelledException.class)
                .satisfies(e -> assertThat(((OperationCancelledException) e).deadlineExceeded()).isTrue());
    }

    @Test
    void earliestDeadlineWins() {
        Instant soon = Instant.now().plusSeconds(60);
        Context ctx = Context.none().withDeadline(soon).withTimeout(Duration.ofHours(2));

        assertThat(ctx.deadline()).isEqualTo(soon);
        assertThat(ctx.isCancelled()).isFalse();
    }
}
