package io.fullerstack.recurrent.signal;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalBufferTest {

    @Test
    void shouldHoldOneSignal() {
        SignalBuffer buffer = new SignalBuffer();

        assertThat(buffer.post()).isTrue();
        assertThat(buffer.isPending()).isTrue();
        assertThat(buffer.take()).isTrue();
        assertThat(buffer.isPending()).isFalse();
        assertThat(buffer.take()).isFalse();
    }

    @Test
    void shouldDropPostWhileSignalPending() {
        AtomicInteger posted = new AtomicInteger();
        SignalBuffer buffer = new SignalBuffer(posted::incrementAndGet);

        assertThat(buffer.post()).isTrue();
        assertThat(buffer.post()).isFalse();
        assertThat(buffer.post()).isFalse();

        assertThat(posted.get()).isEqualTo(1);
        assertThat(buffer.take()).isTrue();
        assertThat(buffer.take()).isFalse();
    }

    @Test
    void shouldAcceptAgainAfterTake() {
        AtomicInteger posted = new AtomicInteger();
        SignalBuffer buffer = new SignalBuffer(posted::incrementAndGet);

        buffer.post();
        buffer.take();

        assertThat(buffer.post()).isTrue();
        assertThat(posted.get()).isEqualTo(2);
    }

    @Test
    void shouldDiscardPendingAndIgnorePostsWhenClosed() {
        AtomicInteger posted = new AtomicInteger();
        SignalBuffer buffer = new SignalBuffer(posted::incrementAndGet);
        buffer.post();

        buffer.close();

        assertThat(buffer.isClosed()).isTrue();
        assertThat(buffer.isPending()).isFalse();
        assertThat(buffer.post()).isFalse();
        assertThat(buffer.take()).isFalse();
        assertThat(posted.get()).isEqualTo(1);
    }

    @Test
    void shouldAdmitExactlyOneOfManyConcurrentPosters() throws Exception {
        AtomicInteger posted = new AtomicInteger();
        AtomicInteger accepted = new AtomicInteger();
        SignalBuffer buffer = new SignalBuffer(posted::incrementAndGet);
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();

        for (int i = 0; i < 8; i++) {
            Thread t = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int j = 0; j < 1000; j++) {
                    if (buffer.post()) {
                        accepted.incrementAndGet();
                    }
                }
            });
            threads.add(t);
            t.start();
        }
        go.countDown();
        for (Thread t : threads) {
            t.join(TimeUnit.SECONDS.toMillis(5));
        }

        assertThat(accepted.get()).isEqualTo(1);
        assertThat(posted.get()).isEqualTo(1);
        assertThat(buffer.isPending()).isTrue();
    }

    @Test
    void shouldRequireNonNullListener() {
        assertThatThrownBy(() -> new SignalBuffer(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("Post listener cannot be null");
    }
}
