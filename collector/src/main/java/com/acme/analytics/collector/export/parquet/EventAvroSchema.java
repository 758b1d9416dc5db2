package com.acme.analytics.collector.export.parquet;

import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;

/**
 * Avro schema of the rows written to Parquet.
 */
public final class EventAvroSchema {
    public static final String NAMESPACE = "com.acme.analytics.collector";

    /** Nested client-facing part of an event. */
    public static final Schema EVENT_PAYLOAD_SCHEMA;

    /** One row per event: id, payload, recorded_at, recorded_by. */
    public static final Schema EVENT_ROW_SCHEMA;

    static {
        EVENT_PAYLOAD_SCHEMA = SchemaBuilder.record("EventPayload")
            .namespace(NAMESPACE)
            .fields()
            .optionalString("ts")
            .requiredString("entity")
            .requiredString("action")
            .optionalString("path")
            .requiredString("app_id")
            .endRecord();

        EVENT_ROW_SCHEMA = SchemaBuilder.record("EventRow")
            .namespace(NAMESPACE)
            .fields()
            .requiredString("id")
            .name("event").type(EVENT_PAYLOAD_SCHEMA).noDefault()
            .requiredString("recorded_at")
            .optionalString("recorded_by")
            .endRecord();
    }

    private EventAvroSchema() {
    }
}
