package io.oraclemesh.ledger;

import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.LedgerCommitment;
import io.oraclemesh.storage.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable ledger. The UNIQUE constraint on {@code store_key} is the conditional write
 * that keeps commits per key atomic across threads and processes; a lost insert race
 * re-reads the winner and compares digests.
 */
public final class SqliteLedgerStore implements LedgerStore {
    private final Database database;
    private final String contractAddress;
    private final Clock clock;

    public SqliteLedgerStore(Database database, String contractAddress) {
        this(database, contractAddress, Clock.systemUTC());
    }

    public SqliteLedgerStore(Database database, String contractAddress, Clock clock) {
        this.database = database;
        this.contractAddress = contractAddress;
        this.clock = clock;
    }

    @Override
    public LedgerCommitment commit(CanonicalRecord record) {
        String digest = record.digest();
        Optional<LedgerCommitment> existing = find(record.runId());
        if (existing.isPresent()) {
            return resolveExisting(existing.get(), digest);
        }
        Instant now = clock.instant();
        LedgerCommitment created = new LedgerCommitment(record.runId(), digest, now.toString(), contractAddress);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO ledger_commitments(store_key,digest,contract_address,committed_at,committed_at_ms) VALUES(?,?,?,?,?)")) {
                ps.setString(1, created.storeKey());
                ps.setString(2, created.digest());
                ps.setString(3, created.contractAddress());
                ps.setString(4, created.committedAt());
                ps.setLong(5, now.toEpochMilli());
                ps.executeUpdate();
                c.commit();
                return created;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            Optional<LedgerCommitment> afterRace = find(record.runId());
            if (afterRace.isPresent()) {
                return resolveExisting(afterRace.get(), digest);
            }
            throw new RuntimeException("Failed to commit ledger key: " + record.runId(), e);
        }
    }

    @Override
    public Optional<LedgerCommitment> find(String storeKey) {
        if (storeKey == null) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT store_key,digest,committed_at,contract_address FROM ledger_commitments WHERE store_key=?")) {
            ps.setString(1, storeKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toCommitment(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read ledger key: " + storeKey, e);
        }
    }

    @Override
    public List<LedgerCommitment> list(int limit) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT store_key,digest,committed_at,contract_address FROM ledger_commitments ORDER BY seq DESC LIMIT ?")) {
            ps.setInt(1, Math.max(1, limit));
            List<LedgerCommitment> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toCommitment(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list ledger commitments", e);
        }
    }

    public long conflictCount(String storeKey) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM ledger_conflicts WHERE store_key=?")) {
            ps.setString(1, storeKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count ledger conflicts: " + storeKey, e);
        }
    }

    private LedgerCommitment resolveExisting(LedgerCommitment stored, String attemptedDigest) {
        if (stored.digest().equals(attemptedDigest)) {
            return stored;
        }
        recordConflict(stored, attemptedDigest);
        throw new LedgerCorruptionException(stored.storeKey(), stored.digest(), attemptedDigest);
    }

    private void recordConflict(LedgerCommitment stored, String attemptedDigest) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO ledger_conflicts(store_key,stored_digest,attempted_digest,occurred_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, stored.storeKey());
            ps.setString(2, stored.digest());
            ps.setString(3, attemptedDigest);
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record ledger conflict: " + stored.storeKey(), e);
        }
    }

    private static LedgerCommitment toCommitment(ResultSet rs) throws SQLException {
        return new LedgerCommitment(
                rs.getString("store_key"),
                rs.getString("digest"),
                rs.getString("committed_at"),
                rs.getString("contract_address")
        );
    }
}
