package com.gentoro.gscmcp.account;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gscmcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AccountRegistryTest {

  @Test
  void registersAndLooksUpByIdAndEmail() {
    AccountRegistry registry = new AccountRegistry();
    Account account = registry.register("main", "Owner@Example.com", "rt-1", null);

    assertSame(account, registry.lookup("main").orElseThrow());
    assertSame(account, registry.lookup("owner@example.com").orElseThrow());
    assertSame(account, registry.lookup("OWNER@EXAMPLE.COM").orElseThrow());
    assertEquals("Owner@Example.com", account.email());
    assertEquals(1, registry.count());
  }

  @Test
  void idMatchWinsOverEmailMatch() {
    AccountRegistry registry = new AccountRegistry();
    Account byEmail = registry.register("first", "b@example.com", "rt-1", null);
    Account byId = registry.register("b@example.com", "other@example.com", "rt-2", null);

    assertSame(byId, registry.lookup("b@example.com").orElseThrow());
    assertNotSame(byEmail, registry.lookup("b@example.com").orElseThrow());
  }

  @Test
  void reRegisteringAnIdReplacesCredentialsAndEmail() {
    AccountRegistry registry = new AccountRegistry();
    registry.register("main", "old@example.com", "rt-1", "at-1");
    Account replaced = registry.register("main", "new@example.com", "rt-2", null);

    assertEquals(1, registry.count());
    assertEquals("rt-2", registry.lookup("main").orElseThrow().credentials().refreshToken());
    assertNull(replaced.credentials().accessToken());
    assertTrue(registry.lookup("old@example.com").isEmpty());
    assertSame(replaced, registry.lookup("new@example.com").orElseThrow());
  }

  @Test
  void rejectsBlankFieldsListingEachOne() {
    AccountRegistry registry = new AccountRegistry();
    ValidationException ex =
        assertThrows(ValidationException.class, () -> registry.register(" ", "", null, null));
    assertTrue(ex.getMessage().contains("id: must not be blank"));
    assertTrue(ex.getMessage().contains("email: must not be blank"));
    assertTrue(ex.getMessage().contains("refreshToken: must not be blank"));
    assertEquals(0, registry.count());
  }

  @Test
  void rejectsEmailOwnedByAnotherId() {
    AccountRegistry registry = new AccountRegistry();
    registry.register("a", "shared@example.com", "rt-1", null);

    assertThrows(
        ValidationException.class,
        () -> registry.register("b", "SHARED@example.com", "rt-2", null));
    assertTrue(registry.lookup("b").isEmpty());
  }

  @Test
  void listIsOrderedByIdAndFirstIsSmallestId() {
    AccountRegistry registry = new AccountRegistry();
    registry.register("zeta", "z@example.com", "rt", null);
    registry.register("alpha", "a@example.com", "rt", null);
    registry.register("mid", "m@example.com", "rt", null);

    assertEquals(
        List.of("alpha", "mid", "zeta"), registry.list().stream().map(Account::id).toList());
    assertEquals("alpha", registry.first().orElseThrow().id());
  }

  @Test
  void listenersSeePreviousAndCurrentAccount() {
    AccountRegistry registry = new AccountRegistry();
    List<String> events = new ArrayList<>();
    registry.addListener(
        (previous, current) ->
            events.add((previous == null ? "-" : previous.email()) + ">" + current.email()));

    registry.register("main", "one@example.com", "rt", null);
    registry.register("main", "two@example.com", "rt", null);

    assertEquals(List.of("-" + ">one@example.com", "one@example.com>two@example.com"), events);
  }

  @Test
  void concurrentRegistrationsKeepBothIndexesConsistent() throws Exception {
    AccountRegistry registry = new AccountRegistry();
    int threads = 8;
    int perThread = 50;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        int thread = t;
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perThread; i++) {
                    String id = "acct-" + (i % 10);
                    registry.register(id, id + "@example.com", "rt-" + thread + "-" + i, null);
                    registry.lookup(id + "@example.com").orElseThrow();
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(10, registry.count());
    for (Account account : registry.list()) {
      assertSame(account, registry.lookup(account.email()).orElseThrow());
    }
  }
}
