package com.shlawgathon.recovery.backend.detector;

import com.shlawgathon.recovery.backend.model.Failure;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class InMemoryFailureRegistry implements FailureRegistry {

    private final Map<String, Failure> failures = new ConcurrentHashMap<>();

    @Override
    public void save(Failure failure) {
        failures.put(failure.getId(), failure);
    }

    @Override
    public Optional<Failure> find(String failureId) {
        if (failureId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(failures.get(failureId));
    }

    @Override
    public Optional<Failure> remove(String failureId) {
        if (failureId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(failures.remove(failureId));
    }

    @Override
    public List<Failure> unresolved() {
        return failures.values().stream()
                .filter(f -> !f.isResolved())
                .sorted(Comparator.comparing(Failure::getTimestamp))
                .collect(Collectors.toList());
    }
}
