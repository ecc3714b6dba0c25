package io.github.samzhu.finops.exception;

/**
 * 文字生成後端沒有回傳任何候選結果或呼叫失敗時拋出。
 *
 * <p>不會自動重試，由呼叫端決定是否重新送出請求。
 */
public class GenerationException extends FinopsException {

    private final String insightType;

    public GenerationException(String insightType, String message) {
        super(String.format("Insight generation failed: type='%s', %s", insightType, message));
        this.insightType = insightType;
    }

    public GenerationException(String insightType, String message, Throwable cause) {
        super(String.format("Insight generation failed: type='%s', %s", insightType, message), cause);
        this.insightType = insightType;
    }

    public String getInsightType() {
        return insightType;
    }
}
