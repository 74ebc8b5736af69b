package com.qqsuccubus.pipeline.core.chunk;

import com.qqsuccubus.pipeline.core.hash.Checksums;
import com.qqsuccubus.pipeline.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reconstructs logical messages from ordered chunk fragments.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>Reject fragments whose index is outside {@code [0, totalChunks)} (MALFORMED)</li>
 *   <li>Verify the slice checksum before storing anything (CHECKSUM_MISMATCH, this fragment only)</li>
 *   <li>Look up or create the partial assembly; a different {@code totalChunks} is MALFORMED</li>
 *   <li>Once every index is present, concatenate in index order and check the optional
 *       whole-message checksum</li>
 * </ol>
 * </p>
 * <p>
 * <b>Concurrency:</b> ingestion is serialized per logical message id through
 * {@link ConcurrentHashMap#compute}; different ids proceed in parallel.
 * </p>
 * <p>
 * <b>Eviction:</b> {@link #sweepExpired()} drops assemblies older than {@code maxAssemblyAge}.
 * Eviction is terminal: the transport does not guarantee redelivery of the whole fragment set.
 * </p>
 */
public class ChunkAssembler {
    private static final Logger log = LoggerFactory.getLogger(ChunkAssembler.class);

    private final Map<String, PartialAssembly> assemblies = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration maxAssemblyAge;

    public ChunkAssembler(Clock clock, Duration maxAssemblyAge) {
        this.clock = clock;
        this.maxAssemblyAge = maxAssemblyAge;
    }

    /**
     * Ingests one fragment.
     *
     * @param fragment Parsed fragment
     * @return Assembly outcome
     */
    public AssemblyResult ingest(ChunkFragment fragment) {
        List<Message> self = fragment.getOrigin() == null
            ? List.of()
            : List.of(fragment.getOrigin());

        if (fragment.getTotalChunks() <= 0
            || fragment.getChunkIndex() < 0
            || fragment.getChunkIndex() >= fragment.getTotalChunks()) {
            return AssemblyResult.malformed(self, String.format(
                "Chunk index %d out of range for %d chunks (id=%s)",
                fragment.getChunkIndex(), fragment.getTotalChunks(), fragment.getLogicalMessageId()
            ));
        }

        if (!Checksums.matches(fragment.getChecksum(), fragment.getPayloadSlice())) {
            return AssemblyResult.checksumMismatch(self, String.format(
                "Checksum mismatch for chunk %d/%d of %s: expected %s, actual %s",
                fragment.getChunkIndex(), fragment.getTotalChunks(), fragment.getLogicalMessageId(),
                fragment.getChecksum(), Checksums.crc32c(fragment.getPayloadSlice())
            ));
        }

        AtomicReference<AssemblyResult> result = new AtomicReference<>();
        assemblies.compute(fragment.getLogicalMessageId(), (id, assembly) -> {
            if (assembly == null) {
                assembly = new PartialAssembly(id, fragment.getTotalChunks(), clock.instant());
            } else if (assembly.getTotalChunks() != fragment.getTotalChunks()) {
                result.set(AssemblyResult.malformed(self, String.format(
                    "Chunk %d of %s declares %d chunks, assembly expects %d",
                    fragment.getChunkIndex(), id, fragment.getTotalChunks(), assembly.getTotalChunks()
                )));
                return assembly;
            }

            if (assembly.add(fragment) == PartialAssembly.AddOutcome.CONFLICTING) {
                result.set(AssemblyResult.malformed(self, String.format(
                    "Chunk %d of %s redelivered with different content", fragment.getChunkIndex(), id
                )));
                return assembly;
            }

            if (!assembly.isComplete()) {
                result.set(AssemblyResult.incomplete());
                return assembly;
            }

            byte[] payload = assembly.concatenate();
            String expected = assembly.getMessageChecksum();
            if (expected != null && !Checksums.matches(expected, payload)) {
                result.set(AssemblyResult.checksumMismatch(assembly.getOrigins(), String.format(
                    "Whole-message checksum mismatch for %s: expected %s, actual %s",
                    id, expected, Checksums.crc32c(payload)
                )));
                return null;
            }

            log.debug("Reassembled {} from {} chunks ({} bytes)", id, assembly.getTotalChunks(), payload.length);
            result.set(AssemblyResult.complete(payload, assembly.getFirstOrigin(), assembly.getOrigins()));
            return null;
        });
        return result.get();
    }

    /**
     * Evicts assemblies that reached {@code maxAssemblyAge}.
     *
     * @return Evicted assemblies; empty (and no state change) when none expired
     */
    public List<PartialAssembly> sweepExpired() {
        Instant now = clock.instant();
        List<PartialAssembly> evicted = new ArrayList<>();
        for (Map.Entry<String, PartialAssembly> entry : assemblies.entrySet()) {
            PartialAssembly assembly = entry.getValue();
            if (!assembly.getCreatedAt().plus(maxAssemblyAge).isAfter(now)
                && assemblies.remove(entry.getKey(), assembly)) {
                evicted.add(assembly);
                log.warn("Evicted partial assembly {} after {} ({} of {} chunks received)",
                    assembly.getLogicalMessageId(), maxAssemblyAge,
                    assembly.getReceivedCount(), assembly.getTotalChunks());
            }
        }
        return evicted;
    }

    public int pendingCount() {
        return assemblies.size();
    }

    public boolean isPending(String logicalMessageId) {
        return assemblies.containsKey(logicalMessageId);
    }
}
