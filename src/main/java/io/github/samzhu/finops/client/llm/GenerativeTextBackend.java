package io.github.samzhu.finops.client.llm;

/**
 * 生成式文字後端。
 *
 * <p>呼叫為阻塞式，呼叫端需自行放到工作執行緒上執行。
 * 傳輸層失敗 (HTTP 錯誤、逾時) 以 {@link BackendException} 回報；
 * 沒有候選結果不視為例外，由呼叫端判斷。
 */
public interface GenerativeTextBackend {

    /**
     * 以指定取樣參數產生文字。
     */
    GenerationResult generate(String prompt, GenerationConfig config);

    /**
     * 後端名稱，用於記錄。
     */
    String model();

    /**
     * 後端呼叫失敗。
     */
    class BackendException extends RuntimeException {

        private final int statusCode;

        public BackendException(String message, int statusCode, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        /**
         * HTTP 狀態碼，非 HTTP 錯誤時為 0。
         */
        public int getStatusCode() {
            return statusCode;
        }
    }
}
