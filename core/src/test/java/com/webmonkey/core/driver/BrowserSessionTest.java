package com.webmonkey.core.driver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrowserSessionTest {

    @Test
    void ensureOpen_opensOnce_and_closeIsIdempotent() {
        FakeSite site = new FakeSite();
        BrowserSession session = new BrowserSession(site.factory(), "t");
        assertThat(session.getState()).isEqualTo(BrowserSession.State.CLOSED);

        BrowserDriver d1 = session.ensureOpen();
        BrowserDriver d2 = session.ensureOpen();
        assertThat(d1).isSameAs(d2);
        assertThat(session.getState()).isEqualTo(BrowserSession.State.OPEN);
        assertThat(site.opened()).isEqualTo(1);

        session.close();
        session.close();
        assertThat(session.getState()).isEqualTo(BrowserSession.State.CLOSED);
        assertThat(((FakeBrowserDriver) d1).isClosed()).isTrue();
        assertThat(site.openNow()).isZero();
    }

    @Test
    void reset_thenEnsureOpen_startsFreshDriver() {
        FakeSite site = new FakeSite();
        try (BrowserSession session = new BrowserSession(site.factory())) {
            BrowserDriver first = session.ensureOpen();
            session.reset();
            BrowserDriver second = session.ensureOpen();

            assertThat(second).isNotSameAs(first);
            assertThat(site.opened()).isEqualTo(2);
            assertThat(site.openNow()).isEqualTo(1);
        }
    }

    @Test
    void factoryFailure_isReportedAsFatal() {
        BrowserSession session = new BrowserSession(() -> { throw new IllegalStateException("no chromium"); });
        assertThatThrownBy(session::ensureOpen)
                .isInstanceOf(DriverException.class)
                .hasMessageContaining("no chromium")
                .satisfies(e -> assertThat(((DriverException) e).isFatal()).isTrue());
        assertThat(session.getState()).isEqualTo(BrowserSession.State.CLOSED);
    }

    @Test
    void nullDriver_isFatal() {
        BrowserSession session = new BrowserSession(() -> null);
        assertThatThrownBy(session::ensureOpen)
                .isInstanceOf(DriverException.class)
                .satisfies(e -> assertThat(((DriverException) e).isFatal()).isTrue());
    }
}
