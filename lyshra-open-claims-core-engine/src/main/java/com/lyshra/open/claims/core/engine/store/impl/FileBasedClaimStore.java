package com.lyshra.open.claims.core.engine.store.impl;

import com.lyshra.open.claims.core.engine.store.AbstractClaimStore;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.CreateClaimRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * File-based implementation of the claim store.
 * Stores each claim as a Java-serialized file and keeps all claims cached in memory.
 *
 * <h2>Storage Structure</h2>
 * <pre>
 * {baseDir}/
 *   └── claims/
 *       ├── {claimId}.claim
 *       └── ...
 * </pre>
 *
 * <h2>Characteristics</h2>
 * <ul>
 *   <li>No database required</li>
 *   <li>Writes go to a temporary file that atomically replaces the previous one</li>
 *   <li>Claims are reloaded into the cache on {@link #initialize()}</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>One process per directory; there is no cross-process locking</li>
 *   <li>Every write is synchronous</li>
 * </ul>
 */
@Slf4j
public class FileBasedClaimStore extends AbstractClaimStore {

    private static final String CLAIMS_DIR = "claims";
    private static final String CLAIM_EXTENSION = ".claim";
    private static final String TEMP_EXTENSION = ".tmp";

    private final Path baseDir;
    private final Path claimsDir;

    public FileBasedClaimStore(Path baseDir, Clock clock) {
        super(clock);
        this.baseDir = baseDir;
        this.claimsDir = baseDir.resolve(CLAIMS_DIR);
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            log.info("Initializing file-based claim store at: {}", baseDir);
            Files.createDirectories(claimsDir);
            claims.clear();
            loadExistingClaims();
            markInitialized(true);
            log.info("File-based claim store initialized. Loaded {} claims.", claims.size());
            return null;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    private void loadExistingClaims() throws IOException {
        try (Stream<Path> files = Files.list(claimsDir)) {
            files.filter(path -> path.toString().endsWith(CLAIM_EXTENSION))
                    .forEach(this::loadClaimFile);
        }
    }

    private void loadClaimFile(Path file) {
        try (ObjectInputStream ois = new ObjectInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            Claim claim = (Claim) ois.readObject();
            claims.put(claim.getId(), claim);
            log.debug("Loaded claim: {} (status: {}, version: {})",
                    claim.getId(), claim.getStatus(), claim.getVersion());
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            log.warn("Skipping unreadable claim file {}: {}", file, e.getMessage());
        }
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based claim store");
            claims.clear();
            markInitialized(false);
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.fromCallable(() -> isInitialized() && Files.isWritable(claimsDir));
    }

    // ========================================================================
    // PERSISTENCE
    // ========================================================================

    @Override
    public Mono<Claim> create(CreateClaimRequest request) {
        return super.create(request).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Claim> update(String claimId, long expectedVersion, UnaryOperator<Claim> mutation) {
        return super.update(claimId, expectedVersion, mutation).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    protected void persist(Claim claim) {
        Path target = getClaimFilePath(claim.getId());
        Path temp = claimsDir.resolve(claim.getId() + TEMP_EXTENSION);
        try {
            try (ObjectOutputStream oos = new ObjectOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
                oos.writeObject(claim);
            }
            moveIntoPlace(temp, target);
            log.debug("Persisted claim: {} (status: {}, version: {})",
                    claim.getId(), claim.getStatus(), claim.getVersion());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not persist claim " + claim.getId(), e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path getClaimFilePath(String claimId) {
        return claimsDir.resolve(claimId + CLAIM_EXTENSION);
    }

    public Path getBaseDir() {
        return baseDir;
    }
}
