package com.webmonkey.core.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 드라이버 하나의 소유권 + 상태 기계 {CLOSED, OPEN}.
 * 외부 호출 지점마다 {@link #ensureOpen()} 을 한 번 호출해서 드라이버를 얻는다.
 * 한 세션은 한 소유자(오케스트레이터 또는 워커 하나)만 쓴다.
 */
public final class BrowserSession implements AutoCloseable {

    public enum State { CLOSED, OPEN }

    private static final Logger LOG = LoggerFactory.getLogger(BrowserSession.class);

    private final DriverFactory factory;
    private final String name;
    private State state = State.CLOSED;
    private BrowserDriver driver;

    public BrowserSession(DriverFactory factory) {
        this(factory, "session");
    }

    public BrowserSession(DriverFactory factory, String name) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.name = name;
    }

    /** CLOSED → OPEN 전이 (이미 OPEN 이면 그대로) */
    public synchronized BrowserDriver ensureOpen() {
        if (state == State.OPEN) return driver;
        LOG.info("Opening browser session: {}", name);
        BrowserDriver d;
        try {
            d = factory.open();
        } catch (DriverException e) {
            throw e;
        } catch (RuntimeException e) {
            throw DriverException.fatal("failed to open browser session '" + name + "': " + e.getMessage(), e);
        }
        if (d == null) throw DriverException.fatal("driver factory returned null for '" + name + "'", null);
        this.driver = d;
        this.state = State.OPEN;
        return d;
    }

    public synchronized State getState() { return state; }

    /** 치명적 드라이버 오류 뒤에 호출: 닫고 다음 ensureOpen() 에서 새로 연다 */
    public synchronized void reset() {
        close();
    }

    /** OPEN → CLOSED (이미 CLOSED 면 무시) */
    @Override
    public synchronized void close() {
        if (state == State.CLOSED) return;
        LOG.info("Closing browser session: {}", name);
        try {
            driver.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing browser session {}: {}", name, e.toString());
        } finally {
            driver = null;
            state = State.CLOSED;
        }
    }
}
