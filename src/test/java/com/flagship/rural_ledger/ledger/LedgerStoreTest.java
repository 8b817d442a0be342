package com.flagship.rural_ledger.ledger;

import com.flagship.rural_ledger.store.EmbeddedStore;
import com.flagship.rural_ledger.store.SchemaManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Try to break the local ledger store.
 *
 * These tests attempt to:
 * - Get an identifier handed out twice
 * - Leave a half-applied bulk import behind
 * - Store entries with bad amounts or dangling references
 *
 * Every test runs against a fresh store file.
 */
class LedgerStoreTest {

    @TempDir
    Path dir;

    private EmbeddedStore store;
    private LedgerStore ledgerStore;
    private ReferenceStore referenceStore;
    private long propertyId;
    private long accountId;

    @BeforeEach
    void setUp() {
        store = new SchemaManager(5000).open(dir.resolve("ledger.db"));
        ledgerStore = new LedgerStore(store);
        referenceStore = new ReferenceStore(store);
        propertyId = referenceStore.createProperty(Property.builder().code("FAZ-01").name("Fazenda Boa Vista").build()).getId();
        accountId = referenceStore.createAccount(BankAccount.builder().code("BB-001").bankName("Banco do Brasil").build()).getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private LedgerEntry.LedgerEntryBuilder entry(LocalDate date) {
        return LedgerEntry.builder()
            .date(date)
            .propertyId(propertyId)
            .accountId(accountId)
            .kind(EntryKind.REVENUE)
            .description("Entry on " + date);
    }

    @Test
    @DisplayName("Created entries get increasing ids and read back unchanged")
    void testCreateAndRead() {
        printTestHeader("Create And Read");

        // Given: An entry with every field set
        LedgerEntry created = ledgerStore.createEntry(entry(LocalDate.of(2024, 3, 15))
            .documentNumber("NF-001.234")
            .documentType("NF")
            .kind(EntryKind.EXPENSE)
            .debit(new BigDecimal("120.40"))
            .author("maria")
            .category("Fertilizer")
            .build());

        // When: Reading it back
        LedgerEntry read = ledgerStore.getEntry(created.getId()).orElseThrow();
        printOutput("Entry", read);

        // Then: Fields survive and the document number keeps only digits
        assertNotNull(created.getId());
        assertEquals(LocalDate.of(2024, 3, 15), read.getDate());
        assertEquals(20240315, read.getOrdinalDate());
        assertEquals("001234", read.getDocumentNumber());
        assertEquals(EntryKind.EXPENSE, read.getKind());
        assertEquals(0, new BigDecimal("120.40").compareTo(read.getDebit()));
        assertEquals(0, BigDecimal.ZERO.compareTo(read.getCredit()));
        assertEquals(0, new BigDecimal("120.40").compareTo(read.getClosingBalance()));
        assertEquals(BalanceSign.NEGATIVE, read.getBalanceSign());
        assertEquals("Fertilizer", read.getCategory());
        assertEquals("maria", read.getAuthor());

        LedgerEntry second = ledgerStore.createEntry(entry(LocalDate.of(2024, 3, 16)).build());
        assertTrue(second.getId() > created.getId());
        printSuccess("Entry stored and read back");
    }

    @Test
    @DisplayName("Deleted ids are never handed out again")
    void testIdsNeverReused() {
        printTestHeader("Ids Never Reused");

        // Given: Three entries, the newest one deleted
        ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 1)).build());
        ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 2)).build());
        LedgerEntry third = ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 3)).build());
        assertTrue(ledgerStore.deleteEntry(third.getId()));

        // When: Creating another entry
        LedgerEntry next = ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 4)).build());
        printOutput("Deleted id", third.getId());
        printOutput("Next id", next.getId());

        // Then: The deleted id is skipped
        assertEquals(third.getId() + 1, next.getId());
        assertTrue(ledgerStore.getEntry(third.getId()).isEmpty());
        assertFalse(ledgerStore.deleteEntry(third.getId()), "second delete finds nothing");
        printSuccess("Identifier was not reused");
    }

    @Test
    @DisplayName("Account balance runs from credits and debits; the newest entry holds it")
    void testAccountBalance() {
        printTestHeader("Account Balance");

        // Given: A credit of 100, then a debit of 150 with a stale balance supplied by the caller
        LedgerEntry first = ledgerStore.createEntry(entry(LocalDate.of(2024, 2, 1))
            .credit(new BigDecimal("100"))
            .build());
        LedgerEntry latest = ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 1))
            .kind(EntryKind.EXPENSE)
            .debit(new BigDecimal("150"))
            .closingBalance(new BigDecimal("999"))
            .build());
        assertEquals(0, new BigDecimal("100").compareTo(first.getSignedBalance()));
        assertEquals(0, new BigDecimal("50").compareTo(latest.getClosingBalance()));
        assertEquals(BalanceSign.NEGATIVE, latest.getBalanceSign());

        // When: Reading the balance
        AccountBalance balance = ledgerStore.accountBalance(accountId).orElseThrow();
        printOutput("Balance", balance);

        // Then: The highest id wins, whatever its date
        assertEquals(latest.getId(), balance.getEntryId());
        assertEquals(0, new BigDecimal("-50").compareTo(balance.getSignedBalance()));
        assertEquals(1, ledgerStore.accountBalances().size());
        assertTrue(ledgerStore.accountBalance(9999).isEmpty());
        printSuccess("Balance is -50");
    }

    @Test
    @DisplayName("Editing an entry rebalances every later entry of its account")
    void testUpdateRebalancesLaterEntries() {
        printTestHeader("Update Rebalances Later Entries");

        // Given: +100, -30, +50 on one account, and an entry on another account in between
        long otherAccount = referenceStore.createAccount(BankAccount.builder().code("CX-002").build()).getId();
        LedgerEntry first = ledgerStore.createEntry(entry(LocalDate.of(2024, 3, 1)).credit(new BigDecimal("100")).build());
        LedgerEntry second = ledgerStore.createEntry(entry(LocalDate.of(2024, 3, 2)).kind(EntryKind.EXPENSE)
            .debit(new BigDecimal("30")).build());
        LedgerEntry unrelated = ledgerStore.createEntry(entry(LocalDate.of(2024, 3, 2)).accountId(otherAccount)
            .credit(new BigDecimal("7")).build());
        LedgerEntry third = ledgerStore.createEntry(entry(LocalDate.of(2024, 3, 3)).credit(new BigDecimal("50")).build());
        assertEquals(0, new BigDecimal("120").compareTo(signedBalance(third)));

        // When: The first credit is corrected to 200
        ledgerStore.updateEntry(first.toBuilder().credit(new BigDecimal("200")).build());

        // Then: Later entries of the same account follow, the other account does not
        assertEquals(0, new BigDecimal("200").compareTo(signedBalance(first)));
        assertEquals(0, new BigDecimal("170").compareTo(signedBalance(second)));
        assertEquals(0, new BigDecimal("220").compareTo(signedBalance(third)));
        assertEquals(0, new BigDecimal("7").compareTo(signedBalance(unrelated)));
        printOutput("Balance after edit", ledgerStore.accountBalance(accountId).orElseThrow());

        // When: The debit moves to the other account
        ledgerStore.updateEntry(ledgerStore.getEntry(second.getId()).orElseThrow().toBuilder()
            .accountId(otherAccount).build());

        // Then: Both accounts are rebalanced
        assertEquals(0, new BigDecimal("250").compareTo(signedBalance(third)));
        assertEquals(0, new BigDecimal("-30").compareTo(signedBalance(second)));
        assertEquals(0, new BigDecimal("-23").compareTo(signedBalance(unrelated)));
        assertEquals(0, new BigDecimal("-23").compareTo(ledgerStore.accountBalance(otherAccount).orElseThrow().getSignedBalance()));
        printSuccess("Running balances follow the edit");
    }

    @Test
    @DisplayName("A writer on another thread waits until a bulk transaction commits")
    void testBulkTransactionIsExclusive() throws Exception {
        printTestHeader("Bulk Transaction Is Exclusive");

        // Given: A bulk transaction that has written and is held open
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicLong releasedAt = new AtomicLong();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> bulk = pool.submit(() -> ledgerStore.runInBulkTransaction(s -> {
                s.createEntry(entry(LocalDate.of(2024, 8, 1)).credit(new BigDecimal("100")).build());
                inside.countDown();
                try {
                    assertTrue(release.await(10, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(inside.await(10, TimeUnit.SECONDS));

            // When: Another thread writes to the same store
            Future<LedgerEntry> writer = pool.submit(
                () -> ledgerStore.createEntry(entry(LocalDate.of(2024, 8, 2)).credit(new BigDecimal("50")).build()));
            Thread.sleep(300);

            // Then: It is still waiting, and completes only after the commit
            assertFalse(writer.isDone(), "second writer must wait for the bulk transaction");
            releasedAt.set(System.nanoTime());
            release.countDown();
            bulk.get(10, TimeUnit.SECONDS);
            LedgerEntry written = writer.get(10, TimeUnit.SECONDS);
            long finishedAt = System.nanoTime();

            printOutput("Second writer balance", written.getSignedBalance());
            assertTrue(finishedAt >= releasedAt.get());
            assertEquals(0, new BigDecimal("150").compareTo(written.getSignedBalance()),
                "second writer saw the committed bulk entry");
            assertEquals(2, ledgerStore.listEntries(OrdinalRange.all(), EntryFilter.none()).size());
        } finally {
            pool.shutdownNow();
        }
        printSuccess("Bulk transaction excluded the concurrent writer");
    }

    @Test
    @DisplayName("Failure on the third of five bulk writes leaves nothing behind")
    void testBulkTransactionRollsBack() {
        printTestHeader("Bulk Transaction Rollback");

        // Given: Five writes where the third has a negative credit
        List<LedgerEntry> batch = List.of(
            entry(LocalDate.of(2024, 5, 1)).credit(BigDecimal.ONE).build(),
            entry(LocalDate.of(2024, 5, 2)).credit(BigDecimal.ONE).build(),
            entry(LocalDate.of(2024, 5, 3)).credit(new BigDecimal("-1")).build(),
            entry(LocalDate.of(2024, 5, 4)).credit(BigDecimal.ONE).build(),
            entry(LocalDate.of(2024, 5, 5)).credit(BigDecimal.ONE).build());

        // When: Importing them in one bulk transaction
        assertThrows(ValidationException.class,
            () -> ledgerStore.runInBulkTransaction(s -> batch.forEach(s::createEntry)));

        // Then: No entry was committed
        Integer count = store.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM ledger_entry", Integer.class);
        printOutput("Entries after failed import", count);
        assertEquals(0, count);
        printSuccess("Import was all-or-nothing");
    }

    @Test
    @DisplayName("A successful bulk transaction commits every write, reference rows included")
    void testBulkTransactionCommits() {
        printTestHeader("Bulk Transaction Commit");

        int created = ledgerStore.withBulkTransaction(s -> {
            long counterpartyId = referenceStore.upsertCounterparty("123.456.789-09", "João Silva", 1);
            for (int day = 1; day <= 3; day++) {
                s.createEntry(entry(LocalDate.of(2024, 6, day)).counterpartyId(counterpartyId).build());
            }
            return 3;
        });

        assertEquals(3, created);
        assertEquals(3, ledgerStore.listEntries(OrdinalRange.all(), EntryFilter.none()).size());
        assertTrue(referenceStore.findCounterpartyIdByTaxId("12345678909").isPresent());
        printSuccess("All writes committed");
    }

    @Test
    @DisplayName("Listings are ordered by date descending, then id descending")
    void testListingOrder() {
        printTestHeader("Listing Order");

        // Given: Entries created out of date order, two on the same day
        LedgerEntry march = ledgerStore.createEntry(entry(LocalDate.of(2024, 3, 1)).build());
        LedgerEntry januaryFirst = ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 10)).build());
        LedgerEntry december = ledgerStore.createEntry(entry(LocalDate.of(2023, 12, 31)).build());
        LedgerEntry januarySecond = ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 10)).build());

        // When: Listing the whole store
        List<Long> ids = ledgerStore.listEntries(OrdinalRange.all(), null).stream()
            .map(LedgerEntry::getId)
            .toList();
        printOutput("Listed ids", ids);

        // Then: Newest date first, ties broken by id
        assertEquals(List.of(march.getId(), januarySecond.getId(), januaryFirst.getId(), december.getId()), ids);

        List<LedgerEntry> january = ledgerStore.listEntries(
            OrdinalRange.between(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)), EntryFilter.none());
        assertEquals(2, january.size());
        printSuccess("Order is deterministic");
    }

    @Test
    @DisplayName("Filters narrow a listing")
    void testListingFilters() {
        long otherAccount = referenceStore.createAccount(BankAccount.builder().code("CX-002").build()).getId();
        ledgerStore.createEntry(entry(LocalDate.of(2024, 4, 1)).description("Milk sale").category("Dairy").build());
        ledgerStore.createEntry(entry(LocalDate.of(2024, 4, 2)).kind(EntryKind.EXPENSE)
            .description("Vaccines").category("Cattle").build());
        ledgerStore.createEntry(entry(LocalDate.of(2024, 4, 3)).accountId(otherAccount)
            .description("Milk sale, second lot").category("Dairy").build());

        assertEquals(2, ledgerStore.listEntries(OrdinalRange.all(),
            EntryFilter.builder().descriptionContains("milk").build()).size());
        assertEquals(1, ledgerStore.listEntries(OrdinalRange.all(),
            EntryFilter.builder().kind(EntryKind.EXPENSE).build()).size());
        assertEquals(1, ledgerStore.listEntries(OrdinalRange.all(),
            EntryFilter.builder().accountId(otherAccount).build()).size());
        assertEquals(2, ledgerStore.listEntries(OrdinalRange.all(),
            EntryFilter.builder().category("Dairy").propertyId(propertyId).build()).size());
    }

    @Test
    @DisplayName("Entries with missing fields, negative amounts or dangling references are rejected")
    void testValidation() {
        printTestHeader("Validation");

        assertThrows(ValidationException.class,
            () -> ledgerStore.createEntry(entry(null).build()), "date is required");
        assertThrows(ValidationException.class,
            () -> ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 1)).kind(null).build()), "kind is required");
        assertThrows(ValidationException.class,
            () -> ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 1)).debit(new BigDecimal("-0.01")).build()));
        assertThrows(ValidationException.class,
            () -> ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 1)).propertyId(null).build()));
        assertThrows(ValidationException.class,
            () -> ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 1)).accountId(424242L).build()));
        assertThrows(ValidationException.class,
            () -> ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 1)).counterpartyId(77L).build()));

        assertEquals(0, ledgerStore.listEntries(OrdinalRange.all(), EntryFilter.none()).size());
        printSuccess("Nothing invalid was stored");
    }

    @Test
    @DisplayName("Updates replace fields; updating a missing entry fails")
    void testUpdate() {
        LedgerEntry created = ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 5)).credit(BigDecimal.TEN).build());

        ledgerStore.updateEntry(created.toBuilder()
            .date(LocalDate.of(2024, 2, 5))
            .credit(new BigDecimal("12.50"))
            .build());

        LedgerEntry read = ledgerStore.getEntry(created.getId()).orElseThrow();
        assertEquals(20240205, read.getOrdinalDate());
        assertEquals(0, new BigDecimal("12.50").compareTo(read.getCredit()));
        Integer storedOrdinal = store.getJdbcTemplate().queryForObject(
            "SELECT ordinal_date FROM ledger_entry WHERE id = ?", Integer.class, created.getId());
        assertEquals(20240205, storedOrdinal);

        assertThrows(IllegalArgumentException.class,
            () -> ledgerStore.updateEntry(created.toBuilder().id(999L).build()));
        assertThrows(ValidationException.class,
            () -> ledgerStore.updateEntry(created.toBuilder().id(null).build()));
    }

    @Test
    @DisplayName("Mirrored entries keep their id and advance the sequence")
    void testMirrorEntry() {
        printTestHeader("Mirror Entry");

        // Given: An entry that arrived from the remote table with id 500
        ledgerStore.mirrorEntry(entry(LocalDate.of(2024, 7, 1)).id(500L).documentNumber("A-77").build());

        // When: Mirroring it again with new values and creating a local entry
        ledgerStore.mirrorEntry(entry(LocalDate.of(2024, 7, 2)).id(500L).description("edited remotely").build());
        LedgerEntry local = ledgerStore.createEntry(entry(LocalDate.of(2024, 7, 3)).build());

        // Then: Last write wins and the local id follows the mirrored one
        LedgerEntry mirrored = ledgerStore.getEntry(500).orElseThrow();
        printOutput("Mirrored", mirrored);
        assertEquals("edited remotely", mirrored.getDescription());
        assertEquals(LocalDate.of(2024, 7, 2), mirrored.getDate());
        assertEquals(501L, local.getId());
        assertThrows(ValidationException.class,
            () -> ledgerStore.mirrorEntry(entry(LocalDate.of(2024, 7, 1)).build()));
        printSuccess("Mirror is idempotent per id");
    }

    @Test
    @DisplayName("Totals, monthly totals and category summaries add up")
    void testAggregates() {
        ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 10)).credit(new BigDecimal("100")).category("Grain").build());
        ledgerStore.createEntry(entry(LocalDate.of(2024, 1, 20)).kind(EntryKind.EXPENSE)
            .debit(new BigDecimal("30")).category("Fuel").build());
        ledgerStore.createEntry(entry(LocalDate.of(2024, 2, 5)).credit(new BigDecimal("200")).category("Grain").build());
        ledgerStore.createEntry(entry(LocalDate.of(2023, 12, 31)).credit(new BigDecimal("999")).build());

        OrdinalRange year = OrdinalRange.between(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

        PeriodTotals totals = ledgerStore.totals(year);
        assertEquals(0, new BigDecimal("300").compareTo(totals.getTotalCredit()));
        assertEquals(0, new BigDecimal("30").compareTo(totals.getTotalDebit()));
        assertEquals(0, new BigDecimal("270").compareTo(totals.getNet()));

        List<PeriodTotals> monthly = ledgerStore.monthlyTotals(year);
        assertEquals(List.of("202401", "202402"), monthly.stream().map(PeriodTotals::getPeriod).toList());
        assertEquals(0, new BigDecimal("70").compareTo(monthly.get(0).getNet()));

        List<CategorySummary> summary = ledgerStore.categorySummary(year);
        assertEquals(3, summary.size());
        CategorySummary januaryGrain = summary.stream()
            .filter(s -> s.getMonth() == 1 && "Grain".equals(s.getCategory()))
            .findFirst().orElseThrow();
        assertEquals(2024, januaryGrain.getYear());
        assertEquals(0, new BigDecimal("100").compareTo(januaryGrain.getTotalCredit()));

        Optional<OrdinalRange> bounds = ledgerStore.ordinalBounds();
        assertEquals(Optional.of(OrdinalRange.of(20231231, 20240205)), bounds);
    }

    @Test
    @DisplayName("An empty store has no date bounds and zero totals")
    void testEmptyStore() {
        assertTrue(ledgerStore.ordinalBounds().isEmpty());
        PeriodTotals totals = ledgerStore.totals(OrdinalRange.all());
        assertEquals(0, BigDecimal.ZERO.compareTo(totals.getTotalCredit()));
        assertTrue(ledgerStore.monthlyTotals(OrdinalRange.all()).isEmpty());
    }

    private BigDecimal signedBalance(LedgerEntry entry) {
        return ledgerStore.getEntry(entry.getId()).orElseThrow().getSignedBalance();
    }

    @Test
    @DisplayName("Document numbers keep only their digits")
    void testNormalizeDocumentNumber() {
        assertEquals("12345", LedgerStore.normalizeDocumentNumber(" 12.345 "));
        assertEquals("9", LedgerStore.normalizeDocumentNumber("NF-9"));
        assertNull(LedgerStore.normalizeDocumentNumber("s/n"));
        assertNull(LedgerStore.normalizeDocumentNumber(null));
    }
}
