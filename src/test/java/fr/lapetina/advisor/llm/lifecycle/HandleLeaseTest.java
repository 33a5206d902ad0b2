package fr.lapetina.advisor.llm.lifecycle;

import fr.lapetina.advisor.llm.engine.bigram.BigramFixtures;
import fr.lapetina.advisor.llm.engine.bigram.BigramModelHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandleLeaseTest {

    private BigramModelHandle handle;
    private HandleLease lease;

    @BeforeEach
    void setUp() {
        handle = BigramFixtures.handle();
        lease = new HandleLease(handle);
    }

    @Test
    @DisplayName("should close the handle at once when retired without holders")
    void shouldCloseWhenRetiredIdle() {
        lease.retire();

        assertThat(lease.isClosed()).isTrue();
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should keep the handle open until the last holder releases it")
    void shouldDeferCloseUntilReleased() {
        assertThat(lease.acquire()).isTrue();
        assertThat(lease.acquire()).isTrue();

        lease.retire();
        assertThat(handle.isClosed()).isFalse();

        lease.release();
        assertThat(handle.isClosed()).isFalse();
        assertThat(lease.holders()).isEqualTo(1);

        lease.release();
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should refuse new holders once retired")
    void shouldRefuseHoldersOnceRetired() {
        lease.acquire();
        lease.retire();

        assertThat(lease.acquire()).isFalse();
        assertThat(lease.holders()).isEqualTo(1);
    }

    @Test
    @DisplayName("should not close a lease that is still installed")
    void shouldNotCloseWhileInstalled() {
        lease.acquire();
        lease.release();

        assertThat(lease.isClosed()).isFalse();
    }

    @Test
    @DisplayName("should reject unbalanced releases")
    void shouldRejectUnbalancedRelease() {
        assertThatThrownBy(lease::release).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should close the handle only once")
    void shouldCloseOnce() {
        lease.retire();
        lease.retire();

        assertThat(handle.isClosed()).isTrue();
        assertThat(lease.holders()).isZero();
    }
}
