package com.acme.analytics.collector.export.parquet;

import com.acme.analytics.collector.event.Event;
import com.acme.analytics.collector.event.EventBatch;
import com.acme.analytics.collector.export.EventSink;
import com.acme.analytics.collector.export.ExportException;
import org.apache.avro.AvroRuntimeException;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.RawLocalFileSystem;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopOutputFile;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes each non-empty batch as one self-contained Parquet file.
 *
 * <p>Files are written under a temporary name and moved into place once complete, so a reader
 * listing {@code *.parquet} never sees a partial file. An empty batch produces no file.</p>
 */
public final class ParquetEventSink implements EventSink {
    private static final Logger LOG = Logger.getLogger(ParquetEventSink.class.getName());
    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
        .withZone(ZoneOffset.UTC);
    public static final String DEFAULT_NAME = "parquet";
    public static final String FILE_SUFFIX = ".parquet";
    private static final String IN_PROGRESS_SUFFIX = ".inprogress";

    private final String name;
    private final Path outputDir;
    private final CompressionCodecName codec;
    private final Schema writerSchema;
    private final Configuration hadoopConf;

    public ParquetEventSink(Path outputDir) {
        this(DEFAULT_NAME, outputDir, CompressionCodecName.SNAPPY);
    }

    public ParquetEventSink(String name, Path outputDir, CompressionCodecName codec) {
        this(name, outputDir, codec, EventAvroSchema.EVENT_ROW_SCHEMA);
    }

    /** Rows are always built against {@link EventAvroSchema#EVENT_ROW_SCHEMA}; {@code writerSchema} is what the file declares. */
    ParquetEventSink(String name, Path outputDir, CompressionCodecName codec, Schema writerSchema) {
        this.name = Objects.requireNonNull(name, "name");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir").toAbsolutePath();
        this.codec = Objects.requireNonNull(codec, "codec");
        this.writerSchema = Objects.requireNonNull(writerSchema, "writerSchema");
        this.hadoopConf = new Configuration();
        // Plain local writes: no .crc side files next to the output.
        this.hadoopConf.set("fs.file.impl", RawLocalFileSystem.class.getName());
        this.hadoopConf.setBoolean("fs.file.impl.disable.cache", true);
    }

    @Override
    public String name() {
        return name;
    }

    public Path outputDir() {
        return outputDir;
    }

    @Override
    public int writeBatch(EventBatch batch) throws ExportException {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            return 0;
        }
        List<GenericRecord> records = toRecords(batch);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ExportException(ExportException.Kind.CONNECTION,
                "cannot create output directory " + outputDir + ": " + e.getMessage(), e);
        }

        String fileName = fileName(batch);
        Path target = outputDir.resolve(fileName);
        Path inProgress = outputDir.resolve(fileName + IN_PROGRESS_SUFFIX);
        try {
            write(inProgress, records);
            moveIntoPlace(inProgress, target);
        } catch (IOException e) {
            deleteQuietly(inProgress);
            throw new ExportException(ExportException.Kind.CONNECTION,
                "failed to write " + target.getFileName() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deleteQuietly(inProgress);
            throw new ExportException(ExportException.Kind.SERIALIZATION,
                "failed to encode batch " + batch.sequence() + ": " + e.getMessage(), e);
        }
        LOG.fine(() -> "Parquet sink wrote " + records.size() + " events to " + target);
        return records.size();
    }

    private void write(Path file, List<GenericRecord> records) throws IOException {
        org.apache.hadoop.fs.Path hadoopPath = new org.apache.hadoop.fs.Path(file.toUri());
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
            .<GenericRecord>builder(HadoopOutputFile.fromPath(hadoopPath, hadoopConf))
            .withSchema(writerSchema)
            .withConf(hadoopConf)
            .withCompressionCodec(codec)
            .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
            .build()) {
            for (GenericRecord record : records) {
                writer.write(record);
            }
        }
    }

    private static void moveIntoPlace(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }

    private static List<GenericRecord> toRecords(EventBatch batch) throws ExportException {
        List<GenericRecord> out = new ArrayList<>(batch.size());
        try {
            for (Event event : batch.events()) {
                out.add(toRecord(event));
            }
        } catch (AvroRuntimeException e) {
            throw new ExportException(ExportException.Kind.SERIALIZATION,
                "failed to encode batch " + batch.sequence() + ": " + e.getMessage(), e);
        }
        return out;
    }

    static GenericRecord toRecord(Event event) {
        GenericRecord payload = new GenericData.Record(EventAvroSchema.EVENT_PAYLOAD_SCHEMA);
        payload.put("ts", event.occurredAt().toString());
        payload.put("entity", event.entity().wireName());
        payload.put("action", event.action().wireName());
        payload.put("path", event.path());
        payload.put("app_id", event.appId());

        GenericRecord row = new GenericData.Record(EventAvroSchema.EVENT_ROW_SCHEMA);
        row.put("id", event.id());
        row.put("event", payload);
        row.put("recorded_at", event.recordedAt().toString());
        row.put("recorded_by", event.appId());
        return row;
    }

    static String fileName(EventBatch batch) {
        return "events-" + FILE_TS.format(batch.drainedAt())
            + "-" + batch.sequence()
            + "-" + UUID.randomUUID().toString().substring(0, 8)
            + FILE_SUFFIX;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to delete partial parquet file " + file, e);
        }
    }
}
