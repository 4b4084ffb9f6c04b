package io.jobs4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Counter document handing out FIFO sequence numbers.
 */
@Document(collection = "job_sequences")
public class JobSequenceDocument {

    @Id
    private String id;

    private long value;

    public JobSequenceDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public long getValue() {
        return value;
    }

    public void setValue(long value) {
        this.value = value;
    }
}
