package com.webmonkey.core.crawler;

import com.webmonkey.core.driver.BrowserDriver;
import com.webmonkey.core.driver.DriverException;
import com.webmonkey.core.driver.ElementHandle;
import com.webmonkey.core.model.ActionReport;
import com.webmonkey.core.model.ScrapeAction;
import com.webmonkey.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 추출 전 스크립트 액션(wait/click/write/press)을 순서대로 실행한다.
 * 요소 없음 등 일반 드라이버 오류는 그 액션만 실패로 기록하고 다음으로 넘어간다.
 * fatal 드라이버 오류는 기록 후 그대로 던져 남은 액션을 중단한다.
 */
public final class ActionRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ActionRunner.class);

    private final Sleeper sleeper;

    public ActionRunner(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @param reports 액션별 결과가 순서대로 추가된다 (예외가 나도 그때까지의 결과는 남는다)
     */
    public void run(BrowserDriver driver, List<ScrapeAction> actions, List<ActionReport> reports)
            throws InterruptedException {
        if (actions == null) return;
        for (int i = 0; i < actions.size(); i++) {
            ScrapeAction a = actions.get(i);
            try {
                perform(driver, a);
                reports.add(ActionReport.ok(i, a));
            } catch (DriverException e) {
                reports.add(ActionReport.failed(i, a, e.getMessage()));
                if (e.isFatal()) {
                    LOG.warn("Action #{} {} hit a fatal driver error, aborting remaining actions: {}", i, a, e.getMessage());
                    throw e;
                }
                LOG.warn("Action #{} {} failed: {}", i, a, e.getMessage());
            }
        }
    }

    private void perform(BrowserDriver driver, ScrapeAction a) throws InterruptedException {
        switch (a.getType()) {
            case WAIT:
                sleeper.sleep(Duration.ofMillis(a.getMilliseconds()));
                break;
            case CLICK:
                driver.findElement(a.getSelector()).click();
                break;
            case WRITE: {
                ElementHandle el = driver.findElement(a.getSelector());
                el.clear();
                el.sendKeys(a.getText() == null ? "" : a.getText());
                break;
            }
            case PRESS:
                driver.pressKey(a.getKey());
                break;
            default:
                throw new DriverException("unsupported action: " + a.getType());
        }
    }
}
