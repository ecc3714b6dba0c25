package io.github.samzhu.finops.exception;

/**
 * 依 ID 查無紀錄時拋出。
 */
public class RecordNotFoundException extends FinopsException {

    private final String collection;
    private final String id;

    public RecordNotFoundException(String collection, String id) {
        super(String.format("Record not found: collection='%s', id='%s'", collection, id));
        this.collection = collection;
        this.id = id;
    }

    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }
}
