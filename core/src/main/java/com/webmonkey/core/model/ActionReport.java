package com.webmonkey.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** 스크립트 액션 하나의 실행 결과 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ActionReport {
    private final int index;
    private final String action;
    private final boolean ok;
    private final String error;

    private ActionReport(int index, String action, boolean ok, String error) {
        this.index = index;
        this.action = action;
        this.ok = ok;
        this.error = error;
    }

    public static ActionReport ok(int index, ScrapeAction a) {
        return new ActionReport(index, String.valueOf(a), true, null);
    }

    public static ActionReport failed(int index, ScrapeAction a, String error) {
        return new ActionReport(index, String.valueOf(a), false, error);
    }

    @JsonProperty("index")  public int getIndex() { return index; }
    @JsonProperty("action") public String getAction() { return action; }
    @JsonProperty("ok")     public boolean isOk() { return ok; }
    @JsonProperty("error")  public String getError() { return error; }
}
