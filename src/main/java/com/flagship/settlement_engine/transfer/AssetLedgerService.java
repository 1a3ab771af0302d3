package com.flagship.settlement_engine.transfer;

import com.flagship.settlement_engine.common.Addresses;
import com.flagship.settlement_engine.common.Uint256;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Asset balances, allowances and the transfer journal.
 *
 * This is the ledger behind the default transfer primitive. It uses JDBC
 * directly so that the guarding conditions ("balance covers the amount",
 * "allowance covers the amount") are evaluated by the database inside the
 * same UPDATE that applies them.
 *
 * Invariants:
 * 1. Balances and allowances never go negative (CHECK constraints)
 * 2. Every transfer writes one DEBIT and one CREDIT of equal amount
 * 3. A transfer joins the caller's transaction; a rolled-back caller undoes it
 */
@Service
@Slf4j
public class AssetLedgerService {

    private final JdbcTemplate jdbcTemplate;

    public AssetLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Moves an asset between holders.
     *
     * When the operator is not the sender, the sender's allowance for the
     * operator is consumed first. A zero amount needs neither an allowance
     * nor a balance and writes no entries.
     *
     * @return the journal transfer id, or empty if the allowance or the
     *         balance did not cover the amount
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<UUID> transfer(TransferLeg leg, String operator) {
        String spender = Addresses.normalize(operator);
        BigDecimal amount = new BigDecimal(leg.getAmount());

        UUID transferId = UUID.randomUUID();
        if (leg.getAmount().signum() == 0) {
            return Optional.of(transferId);
        }

        if (!spender.equals(leg.getFrom())) {
            int allowanceRows = jdbcTemplate.update(
                "UPDATE asset_allowances SET amount = amount - ? " +
                "WHERE asset = ? AND owner = ? AND spender = ? AND amount >= ?",
                amount, leg.getAsset(), leg.getFrom(), spender, amount);
            if (allowanceRows == 0) {
                log.debug("Allowance too low: asset={}, owner={}, spender={}, amount={}",
                        leg.getAsset(), leg.getFrom(), spender, leg.getAmount());
                return Optional.empty();
            }
        }

        int debitRows = jdbcTemplate.update(
            "UPDATE asset_balances SET amount = amount - ? " +
            "WHERE asset = ? AND holder = ? AND amount >= ?",
            amount, leg.getAsset(), leg.getFrom(), amount);
        if (debitRows == 0) {
            log.debug("Balance too low: asset={}, holder={}, amount={}",
                    leg.getAsset(), leg.getFrom(), leg.getAmount());
            return Optional.empty();
        }
        addToBalance(leg.getAsset(), leg.getTo(), amount);

        String description = String.format("Transfer %s by %s", transferId, spender);
        createLedgerEntry(transferId, leg.getAsset(), leg.getFrom(), amount, EntryType.DEBIT, description);
        createLedgerEntry(transferId, leg.getAsset(), leg.getTo(), amount, EntryType.CREDIT, description);

        return Optional.of(transferId);
    }

    /**
     * Issues new units of an asset to a holder. Used for bootstrapping holders;
     * not reachable from the public API.
     */
    @Transactional
    public void mint(String asset, String holder, BigInteger amount) {
        Uint256.require(amount, "amount");
        addToBalance(Addresses.normalize(asset), Addresses.normalize(holder), new BigDecimal(amount));
        log.info("Minted asset: asset={}, holder={}, amount={}", asset, holder, amount);
    }

    /**
     * Sets the amount {@code spender} may pull from {@code owner}, replacing any previous allowance.
     */
    @Transactional
    public void approve(String asset, String owner, String spender, BigInteger amount) {
        Uint256.require(amount, "amount");
        jdbcTemplate.update(
            "INSERT INTO asset_allowances (asset, owner, spender, amount) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT (asset, owner, spender) DO UPDATE SET amount = EXCLUDED.amount",
            Addresses.normalize(asset), Addresses.normalize(owner), Addresses.normalize(spender),
            new BigDecimal(amount));
        log.info("Allowance set: asset={}, owner={}, spender={}, amount={}", asset, owner, spender, amount);
    }

    public BigInteger balanceOf(String asset, String holder) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM asset_balances WHERE asset = ? AND holder = ?",
            BigDecimal.class,
            Addresses.normalize(asset), Addresses.normalize(holder));
        return rows.isEmpty() ? BigInteger.ZERO : rows.get(0).toBigInteger();
    }

    public BigInteger allowance(String asset, String owner, String spender) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM asset_allowances WHERE asset = ? AND owner = ? AND spender = ?",
            BigDecimal.class,
            Addresses.normalize(asset), Addresses.normalize(owner), Addresses.normalize(spender));
        return rows.isEmpty() ? BigInteger.ZERO : rows.get(0).toBigInteger();
    }

    /**
     * Gets both journal entries of a transfer, debit first.
     */
    public List<LedgerEntry> getLedgerEntriesForTransfer(UUID transferId) {
        return jdbcTemplate.query(
            "SELECT id, transfer_id, asset, holder, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE transfer_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transferId
        );
    }

    public List<LedgerEntry> getLedgerEntriesForHolder(String asset, String holder) {
        return jdbcTemplate.query(
            "SELECT id, transfer_id, asset, holder, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE asset = ? AND holder = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            Addresses.normalize(asset), Addresses.normalize(holder)
        );
    }

    private void addToBalance(String asset, String holder, BigDecimal amount) {
        jdbcTemplate.update(
            "INSERT INTO asset_balances (asset, holder, amount) VALUES (?, ?, ?) " +
            "ON CONFLICT (asset, holder) DO UPDATE SET amount = asset_balances.amount + EXCLUDED.amount",
            asset, holder, amount);
    }

    private void createLedgerEntry(UUID transferId, String asset, String holder, BigDecimal amount,
                                   EntryType entryType, String description) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transfer_id, asset, holder, amount, entry_type, description, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transferId,
            asset,
            holder,
            amount,
            entryType.name(),
            description
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transfer_id")),
            rs.getString("asset"),
            rs.getString("holder"),
            rs.getBigDecimal("amount").toBigInteger(),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getLong("sequence_number")
        );
    }
}
