package com.logsense.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.logsense.anomaly.config.AerospikeConfig;
import com.logsense.anomaly.engine.RunRecorder;
import com.logsense.anomaly.model.AnomalyRecord;
import com.logsense.anomaly.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Stores detection runs in the {@code runs} set and their anomalies in {@code run_anomalies}.
 * Run ids come from an atomic counter record in {@code sequences}.
 */
@Repository
public class RunRepository implements RunRecorder {

    private static final Logger log = LoggerFactory.getLogger(RunRepository.class);

    static final String FIELD_DELIMITER = ",";
    static final String SEQUENCE_BIN = "seq";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;

    public RunRepository(AerospikeClient client,
                         @Qualifier("aerospikeNamespace") String namespace,
                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                         @Qualifier("defaultReadPolicy") Policy readPolicy,
                         @Qualifier("defaultScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.scanPolicy = scanPolicy;
    }

    @Override
    public RunSummary record(int totalPoints, List<AnomalyRecord> anomalies) {
        long runId = nextRunId();
        RunSummary run = RunSummary.builder()
                .id(runId)
                .createdAt(Instant.now().toString())
                .totalPoints(totalPoints)
                .anomaliesFound(anomalies.size())
                .build();

        // anomalies before the summary, so a listed run never shows up without its rows
        for (int i = 0; i < anomalies.size(); i++) {
            saveAnomaly(runId, i, anomalies.get(i));
        }
        saveRun(run);

        log.debug("Recorded run {}: {} points, {} anomalies", runId, totalPoints, anomalies.size());
        return run;
    }

    public RunSummary findById(long runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_RUNS, runId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRun(record);
    }

    /**
     * Most recent runs first.
     */
    public List<RunSummary> findRecent(int limit) {
        List<RunSummary> results = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RUNS,
                (key, record) -> {
                    try {
                        RunSummary run = mapRun(record);
                        synchronized (results) {
                            results.add(run);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read run record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(RunSummary::getId).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    /**
     * Anomalies of one run, highest score first.
     */
    public List<AnomalyRecord> findAnomalies(long runId) {
        List<IndexedAnomaly> results = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RUN_ANOMALIES,
                (key, record) -> {
                    try {
                        if (record.getLong("runId") != runId) return;
                        IndexedAnomaly anomaly = new IndexedAnomaly(record.getInt("idx"), mapAnomaly(record));
                        synchronized (results) {
                            results.add(anomaly);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingDouble((IndexedAnomaly a) -> a.anomaly().getScore()).reversed()
                .thenComparingInt(IndexedAnomaly::index));
        return results.stream().map(IndexedAnomaly::anomaly).toList();
    }

    long nextRunId() {
        Key key = new Key(namespace, AerospikeConfig.SET_SEQUENCES, AerospikeConfig.SET_RUNS);
        Record record = client.operate(writePolicy, key,
                Operation.add(new Bin(SEQUENCE_BIN, 1L)),
                Operation.get(SEQUENCE_BIN));
        return record.getLong(SEQUENCE_BIN);
    }

    private void saveRun(RunSummary run) {
        Key key = new Key(namespace, AerospikeConfig.SET_RUNS, run.getId());

        Bin idBin = new Bin("id", run.getId());
        Bin createdAtBin = new Bin("createdAt", run.getCreatedAt());
        Bin totalPointsBin = new Bin("totalPoints", run.getTotalPoints());
        Bin anomaliesFoundBin = new Bin("anomaliesFound", run.getAnomaliesFound());

        client.put(writePolicy, key, idBin, createdAtBin, totalPointsBin, anomaliesFoundBin);
    }

    private void saveAnomaly(long runId, int index, AnomalyRecord anomaly) {
        Key key = new Key(namespace, AerospikeConfig.SET_RUN_ANOMALIES, runId + "-" + index);

        Bin runIdBin = new Bin("runId", runId);
        Bin indexBin = new Bin("idx", index);
        Bin tsBin = new Bin("ts", anomaly.getTs());
        Bin scoreBin = new Bin("score", anomaly.getScore());
        Bin fieldsBin = new Bin("fields", joinFields(anomaly.getFields()));
        Bin noteBin = new Bin("note", anomaly.getNote());

        client.put(writePolicy, key, runIdBin, indexBin, tsBin, scoreBin, fieldsBin, noteBin);
    }

    private RunSummary mapRun(Record record) {
        return RunSummary.builder()
                .id(record.getLong("id"))
                .createdAt(record.getString("createdAt"))
                .totalPoints(record.getInt("totalPoints"))
                .anomaliesFound(record.getInt("anomaliesFound"))
                .build();
    }

    private AnomalyRecord mapAnomaly(Record record) {
        return AnomalyRecord.builder()
                .ts(record.getString("ts"))
                .score(record.getDouble("score"))
                .fields(splitFields(record.getString("fields")))
                .note(record.getString("note"))
                .build();
    }

    static String joinFields(List<String> fields) {
        return fields == null ? "" : String.join(FIELD_DELIMITER, fields);
    }

    static List<String> splitFields(String fields) {
        if (fields == null || fields.isEmpty()) return Collections.emptyList();
        return List.copyOf(Arrays.asList(fields.split(FIELD_DELIMITER)));
    }

    private record IndexedAnomaly(int index, AnomalyRecord anomaly) {}
}
