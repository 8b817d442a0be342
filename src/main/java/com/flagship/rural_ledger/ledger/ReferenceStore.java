package com.flagship.rural_ledger.ledger;

import com.flagship.rural_ledger.store.EmbeddedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

import static com.flagship.rural_ledger.ledger.LedgerStore.amount;
import static com.flagship.rural_ledger.ledger.LedgerStore.nullableLong;

/**
 * CRUD over the dimension rows ledger entries refer to: properties, bank
 * accounts, counterparties and per-profile declaration parameters.
 *
 * Shares the store's data source with {@link LedgerStore}, so these writes
 * take part in a bulk transaction opened there.
 */
@Slf4j
public class ReferenceStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public ReferenceStore(EmbeddedStore store) {
        this.jdbcTemplate = store.getJdbcTemplate();
        this.transactionTemplate = store.getTransactionTemplate();
    }

    // ==================== Properties ====================

    public Property createProperty(Property property) {
        requireText("property code", property.getCode());
        requireText("property name", property.getName());
        Long id = insertReturningId(
            "INSERT INTO property (code, name, country, currency, land_registry, state_registration, " +
            "address, city, state, zip_code, exploration_type, share, total_area, used_area) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            property.getCode(), property.getName(),
            property.getCountry() != null ? property.getCountry() : "BR",
            property.getCurrency() != null ? property.getCurrency() : "BRL",
            property.getLandRegistry(), property.getStateRegistration(), property.getAddress(),
            property.getCity(), property.getState(), property.getZipCode(), property.getExplorationType(),
            property.getShare(), property.getTotalArea(), property.getUsedArea());
        log.debug("Created property {} ({})", id, property.getCode());
        return property.toBuilder().id(id).build();
    }

    public void updateProperty(Property property) {
        int updated = jdbcTemplate.update(
            "UPDATE property SET code = ?, name = ?, country = ?, currency = ?, land_registry = ?, " +
            "state_registration = ?, address = ?, city = ?, state = ?, zip_code = ?, exploration_type = ?, " +
            "share = ?, total_area = ?, used_area = ? WHERE id = ?",
            property.getCode(), property.getName(), property.getCountry(), property.getCurrency(),
            property.getLandRegistry(), property.getStateRegistration(), property.getAddress(),
            property.getCity(), property.getState(), property.getZipCode(), property.getExplorationType(),
            property.getShare(), property.getTotalArea(), property.getUsedArea(), property.getId());
        requireUpdated(updated, "Property", property.getId());
    }

    public boolean deleteProperty(long id) {
        return deleteReferenced("property", "property_id", id);
    }

    public Optional<Property> getProperty(long id) {
        return jdbcTemplate.query("SELECT * FROM property WHERE id = ?", propertyRowMapper(), id)
            .stream().findFirst();
    }

    public Optional<Long> findPropertyIdByCode(String code) {
        return jdbcTemplate.queryForList("SELECT id FROM property WHERE code = ?", Long.class, code)
            .stream().findFirst();
    }

    public List<Property> listProperties() {
        return jdbcTemplate.query("SELECT * FROM property ORDER BY name", propertyRowMapper());
    }

    // ==================== Bank accounts ====================

    public BankAccount createAccount(BankAccount account) {
        requireText("account code", account.getCode());
        Long id = insertReturningId(
            "INSERT INTO bank_account (code, country, bank_code, bank_name, agency, account_number, " +
            "opening_balance, opened_on) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            account.getCode(),
            account.getCountry() != null ? account.getCountry() : "BR",
            account.getBankCode(), account.getBankName(), account.getAgency(), account.getAccountNumber(),
            account.getOpeningBalance() != null ? account.getOpeningBalance() : java.math.BigDecimal.ZERO,
            account.getOpenedOn() != null ? account.getOpenedOn().toString() : null);
        log.debug("Created bank account {} ({})", id, account.getCode());
        return account.toBuilder().id(id).build();
    }

    public void updateAccount(BankAccount account) {
        int updated = jdbcTemplate.update(
            "UPDATE bank_account SET code = ?, country = ?, bank_code = ?, bank_name = ?, agency = ?, " +
            "account_number = ?, opening_balance = ?, opened_on = ? WHERE id = ?",
            account.getCode(), account.getCountry(), account.getBankCode(), account.getBankName(),
            account.getAgency(), account.getAccountNumber(), account.getOpeningBalance(),
            account.getOpenedOn() != null ? account.getOpenedOn().toString() : null, account.getId());
        requireUpdated(updated, "Bank account", account.getId());
    }

    public boolean deleteAccount(long id) {
        return deleteReferenced("bank_account", "account_id", id);
    }

    public Optional<BankAccount> getAccount(long id) {
        return jdbcTemplate.query("SELECT * FROM bank_account WHERE id = ?", accountRowMapper(), id)
            .stream().findFirst();
    }

    public List<BankAccount> listAccounts() {
        return jdbcTemplate.query("SELECT * FROM bank_account ORDER BY code", accountRowMapper());
    }

    // ==================== Counterparties ====================

    /**
     * Inserts or updates a counterparty by its tax id (digits only).
     *
     * @return the counterparty id
     */
    public long upsertCounterparty(String taxId, String name, int kind) {
        String digits = taxId == null ? "" : taxId.replaceAll("\\D+", "");
        if (digits.length() != 11 && digits.length() != 14) {
            throw new ValidationException("Tax id must have 11 (CPF) or 14 (CNPJ) digits: " + taxId);
        }
        requireText("counterparty name", name);
        Long id = transactionTemplate.execute(status -> {
            Optional<Long> existing = findCounterpartyIdByTaxId(digits);
            if (existing.isPresent()) {
                jdbcTemplate.update("UPDATE counterparty SET name = ?, kind = ? WHERE id = ?",
                    name.trim(), kind, existing.get());
                return existing.get();
            }
            jdbcTemplate.update("INSERT INTO counterparty (tax_id, name, kind) VALUES (?, ?, ?)",
                digits, name.trim(), kind);
            return jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        });
        log.debug("Upserted counterparty {} ({})", id, digits);
        return id;
    }

    public Optional<Long> findCounterpartyIdByTaxId(String taxId) {
        return jdbcTemplate.queryForList("SELECT id FROM counterparty WHERE tax_id = ?", Long.class, taxId)
            .stream().findFirst();
    }

    public Optional<Counterparty> getCounterparty(long id) {
        return jdbcTemplate.query("SELECT id, tax_id, name, kind FROM counterparty WHERE id = ?",
            counterpartyRowMapper(), id).stream().findFirst();
    }

    public List<Counterparty> listCounterparties() {
        return jdbcTemplate.query("SELECT id, tax_id, name, kind FROM counterparty ORDER BY name",
            counterpartyRowMapper());
    }

    public boolean deleteCounterparty(long id) {
        return deleteReferenced("counterparty", "counterparty_id", id);
    }

    // ==================== Profile parameters ====================

    /**
     * Inserts or replaces the parameters of {@code profile}.
     */
    public void upsertProfileParams(String profile, ProfileParams params) {
        requireText("profile", profile);
        jdbcTemplate.update(
            "INSERT OR REPLACE INTO profile_params (profile, version, period_start_indicator, " +
            "special_situation, ident, name, street, number, complement, district, state, city_code, " +
            "zip_code, phone, email, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            profile, params.getVersion(), params.getPeriodStartIndicator(), params.getSpecialSituation(),
            params.getIdent(), params.getName(), params.getStreet(), params.getNumber(),
            params.getComplement(), params.getDistrict(), params.getState(), params.getCityCode(),
            params.getZipCode(), params.getPhone(), params.getEmail());
        log.debug("Saved parameters of profile {}", profile);
    }

    public Optional<ProfileParams> getProfileParams(String profile) {
        return jdbcTemplate.query("SELECT * FROM profile_params WHERE profile = ?",
            (rs, rowNum) -> ProfileParams.builder()
                .profile(rs.getString("profile"))
                .version(rs.getString("version"))
                .periodStartIndicator((Integer) rs.getObject("period_start_indicator"))
                .specialSituation((Integer) rs.getObject("special_situation"))
                .ident(rs.getString("ident"))
                .name(rs.getString("name"))
                .street(rs.getString("street"))
                .number(rs.getString("number"))
                .complement(rs.getString("complement"))
                .district(rs.getString("district"))
                .state(rs.getString("state"))
                .cityCode(rs.getString("city_code"))
                .zipCode(rs.getString("zip_code"))
                .phone(rs.getString("phone"))
                .email(rs.getString("email"))
                .build(),
            profile).stream().findFirst();
    }

    // ==================== Helpers ====================

    private Long insertReturningId(String sql, Object... args) {
        return transactionTemplate.execute(status -> {
            jdbcTemplate.update(sql, args);
            return jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        });
    }

    private boolean deleteReferenced(String table, String ledgerColumn, long id) {
        Integer uses = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entry WHERE " + ledgerColumn + " = ?", Integer.class, id);
        if (uses != null && uses > 0) {
            throw new ValidationException(table + " " + id + " is used by " + uses + " ledger entries");
        }
        try {
            return jdbcTemplate.update("DELETE FROM " + table + " WHERE id = ?", id) > 0;
        } catch (DataIntegrityViolationException e) {
            throw new ValidationException(table + " " + id + " is still referenced");
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static void requireUpdated(int updated, String what, Long id) {
        if (updated == 0) {
            throw new IllegalArgumentException(what + " not found: " + id);
        }
    }

    private RowMapper<Property> propertyRowMapper() {
        return (rs, rowNum) -> Property.builder()
            .id(rs.getLong("id"))
            .code(rs.getString("code"))
            .name(rs.getString("name"))
            .country(rs.getString("country"))
            .currency(rs.getString("currency"))
            .landRegistry(rs.getString("land_registry"))
            .stateRegistration(rs.getString("state_registration"))
            .address(rs.getString("address"))
            .city(rs.getString("city"))
            .state(rs.getString("state"))
            .zipCode(rs.getString("zip_code"))
            .explorationType((Integer) rs.getObject("exploration_type"))
            .share(rs.getBigDecimal("share"))
            .totalArea(rs.getBigDecimal("total_area"))
            .usedArea(rs.getBigDecimal("used_area"))
            .build();
    }

    private RowMapper<BankAccount> accountRowMapper() {
        return (rs, rowNum) -> BankAccount.builder()
            .id(rs.getLong("id"))
            .code(rs.getString("code"))
            .country(rs.getString("country"))
            .bankCode(rs.getString("bank_code"))
            .bankName(rs.getString("bank_name"))
            .agency(rs.getString("agency"))
            .accountNumber(rs.getString("account_number"))
            .openingBalance(amount(rs, "opening_balance"))
            .openedOn(OrdinalDate.parseLegacy(rs.getString("opened_on")).orElse(null))
            .build();
    }

    private RowMapper<Counterparty> counterpartyRowMapper() {
        return (rs, rowNum) -> new Counterparty(
            nullableLong(rs, "id"),
            rs.getString("tax_id"),
            rs.getString("name"),
            rs.getInt("kind"));
    }
}
