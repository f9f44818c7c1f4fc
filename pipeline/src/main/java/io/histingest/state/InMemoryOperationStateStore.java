package io.histingest.state;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryOperationStateStore implements OperationStateStore {
    private final Map<String, OperationSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<OperationSnapshot> get(String jobId) {
        return Optional.ofNullable(snapshots.get(jobId));
    }

    @Override
    public void put(OperationSnapshot snapshot) {
        snapshots.put(snapshot.jobId(), snapshot);
    }

    @Override
    public List<OperationSnapshot> list() {
        List<OperationSnapshot> out = new ArrayList<>(snapshots.values());
        out.sort(Comparator.comparing(OperationSnapshot::startedAt));
        return out;
    }

    @Override
    public boolean delete(String jobId) {
        return snapshots.remove(jobId) != null;
    }
}
