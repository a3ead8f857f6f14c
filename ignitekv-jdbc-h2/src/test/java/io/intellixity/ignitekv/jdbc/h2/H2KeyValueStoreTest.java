package io.intellixity.ignitekv.jdbc.h2;

import io.intellixity.ignitekv.config.PutStrategy;
import io.intellixity.ignitekv.config.StoreConfig;
import io.intellixity.ignitekv.exec.ConnectionState;
import io.intellixity.ignitekv.jdbc.JdbcKeyValueStore;
import io.intellixity.ignitekv.jdbc.JdbcKeyValueStores;
import io.intellixity.ignitekv.store.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class H2KeyValueStoreTest {
  private static final String PREFIX = "h2://mem/";

  private final List<KeyValueStore> opened = new ArrayList<>();

  @AfterEach
  void closeStores() {
    opened.forEach(KeyValueStore::close);
  }

  private JdbcKeyValueStore open(StoreConfig config) {
    JdbcKeyValueStore s = JdbcKeyValueStores.open(config, "kv_" + UUID.randomUUID().toString().replace("-", ""));
    opened.add(s);
    return s;
  }

  private JdbcKeyValueStore open() {
    return open(StoreConfig.of(PREFIX, 256, 1024));
  }

  private static ByteArray b(String s) {
    return ByteArray.utf8(s);
  }

  private static List<String> keys(CloseableIterator<KeyValue> it) {
    try (it) {
      List<String> out = new ArrayList<>();
      it.forEachRemaining(kv -> out.add(kv.key().toUtf8()));
      return out;
    }
  }

  @Test
  void opensAndReportsConnected() {
    JdbcKeyValueStore s = open();
    assertTrue(s.isOpen());
    assertEquals(ConnectionState.CONNECTED, s.connectionState());
    assertEquals("h2", s.location().scheme());
    assertNotNull(s.handle());
  }

  @Test
  void putThenGetReturnsValue() {
    JdbcKeyValueStore s = open();
    s.put(b("a"), b("1"));
    assertEquals(b("1"), s.get(b("a")));

    s.put(b("a"), b("2"));
    assertEquals(b("2"), s.get(b("a")));
  }

  @Test
  void roundTripsArbitraryBytes() {
    JdbcKeyValueStore s = open();
    ByteArray key = ByteArray.of(new byte[] {0, (byte) 0xff, 0x20});
    ByteArray value = ByteArray.of(new byte[] {(byte) 0x80, 0, 0x20, 0x20});
    s.put(key, value);
    assertEquals(value, s.get(key));
  }

  @Test
  void deleteThenGetIsNotFound() {
    JdbcKeyValueStore s = open();
    s.put(b("a"), b("1"));
    s.delete(b("a"));
    assertThrows(NotFoundException.class, () -> s.get(b("a")));
    assertTrue(s.find(b("a")).isEmpty());
  }

  @Test
  void deleteOfAbsentKeySucceeds() {
    JdbcKeyValueStore s = open();
    assertDoesNotThrow(() -> s.delete(b("never-written")));
  }

  @Test
  void batchAppliesLastWriteWins() {
    JdbcKeyValueStore s = open();
    s.put(b("z"), b("old"));
    s.batch(List.of(
        WriteOp.put(b("x"), b("10")),
        WriteOp.delete(b("x")),
        WriteOp.put(b("y"), b("1")),
        WriteOp.put(b("y"), b("2")),
        WriteOp.delete(b("z"))
    ));
    assertTrue(s.find(b("x")).isEmpty());
    assertEquals(b("2"), s.get(b("y")));
    assertTrue(s.find(b("z")).isEmpty());
  }

  @Test
  void batchPutThenDeleteLeavesKeyAbsent() {
    JdbcKeyValueStore s = open();
    s.batch(List.of(WriteOp.put(b("x"), b("1")), WriteOp.delete(b("x"))));
    assertThrows(NotFoundException.class, () -> s.get(b("x")));
  }

  @Test
  void rangeIteratesInKeyOrderBothWays() {
    JdbcKeyValueStore s = open();
    s.batch(List.of(
        WriteOp.put(b("c"), b("3")),
        WriteOp.put(b("a"), b("1")),
        WriteOp.put(b("b"), b("2"))
    ));

    RangeQuery asc = RangeQuery.builder().gte("a").lt("c").build();
    assertEquals(List.of("a", "b"), keys(s.iterator(asc)));

    RangeQuery desc = RangeQuery.builder().gte("a").lt("c").reverse(true).build();
    assertEquals(List.of("b", "a"), keys(s.iterator(desc)));

    assertEquals(List.of("a", "b", "c"), keys(s.iterator(RangeQuery.all())));
    assertEquals(List.of("c", "b"), keys(s.iterator(RangeQuery.builder().gt("a").lte("c").reverse(true).build())));
  }

  @Test
  void rangeHonoursLimit() {
    JdbcKeyValueStore s = open();
    for (String k : List.of("a", "b", "c", "d")) s.put(b(k), b(k));
    assertEquals(List.of("a", "b"), keys(s.iterator(RangeQuery.builder().limit(2).build())));
    assertEquals(List.of("d"), keys(s.iterator(RangeQuery.builder().reverse(true).limit(1).build())));
    assertEquals(List.of(), keys(s.iterator(RangeQuery.builder().limit(0).build())));
  }

  @Test
  void orderFollowsUnsignedBytes() {
    JdbcKeyValueStore s = open();
    ByteArray low = ByteArray.of(new byte[] {0x01});
    ByteArray high = ByteArray.of(new byte[] {(byte) 0xf0});
    ByteArray longer = ByteArray.of(new byte[] {0x01, 0x00});
    s.put(high, b("h"));
    s.put(longer, b("l2"));
    s.put(low, b("l"));

    List<ByteArray> got;
    try (CloseableIterator<KeyValue> it = s.iterator(RangeQuery.all())) {
      got = it.stream().map(KeyValue::key).collect(Collectors.toList());
    }
    assertEquals(List.of(low, longer, high), got);
  }

  @Test
  void iteratorStreamReadsAllEntries() {
    JdbcKeyValueStore s = open();
    s.put(b("a"), b("1"));
    s.put(b("b"), b("2"));
    try (var stream = s.iterator(RangeQuery.all()).stream()) {
      assertEquals(List.of(KeyValue.of("a", "1"), KeyValue.of("b", "2")), stream.collect(Collectors.toList()));
    }
  }

  @Test
  void sizedScenarioFromDefaultWidths() {
    JdbcKeyValueStore s = open(StoreConfig.of(PREFIX, 256, 1024));
    s.put(b("a"), b("1"));
    s.put(b("b"), b("2"));
    s.put(b("c"), b("3"));

    List<KeyValue> asc = new ArrayList<>();
    try (CloseableIterator<KeyValue> it = s.iterator(RangeQuery.builder().gte("a").lt("c").build())) {
      it.forEachRemaining(asc::add);
    }
    assertEquals(List.of(KeyValue.of("a", "1"), KeyValue.of("b", "2")), asc);

    List<KeyValue> desc = new ArrayList<>();
    try (CloseableIterator<KeyValue> it = s.iterator(RangeQuery.builder().gte("a").lt("c").reverse(true).build())) {
      it.forEachRemaining(desc::add);
    }
    assertEquals(List.of(KeyValue.of("b", "2"), KeyValue.of("a", "1")), desc);
  }

  @Test
  void rejectsOversizedKeysAndValues() {
    JdbcKeyValueStore s = open(StoreConfig.of(PREFIX, 4, 8));
    assertDoesNotThrow(() -> s.put(b("ab"), b("abcd")));
    assertThrows(ValueTooLargeException.class, () -> s.put(b("abc"), b("v")));
    ValueTooLargeException ex = assertThrows(ValueTooLargeException.class, () -> s.put(b("ab"), b("abcde")));
    assertEquals("value", ex.column());
  }

  @Test
  void updateThenInsertStrategyWritesAndOverwrites() {
    JdbcKeyValueStore s = open(StoreConfig.of(PREFIX, 64, 64).withPutStrategy(PutStrategy.UPDATE_THEN_INSERT));
    s.put(b("k"), b("1"));
    s.put(b("k"), b("2"));
    assertEquals(b("2"), s.get(b("k")));
  }

  @Test
  void closeInvalidatesHandle() {
    JdbcKeyValueStore s = open();
    s.put(b("a"), b("1"));
    s.close();
    assertFalse(s.isOpen());
    assertNull(s.handle());
    assertThrows(NotInitializedException.class, () -> s.get(b("a")));
  }

  @Test
  void reopeningKeepsData() {
    String cache = "kv_" + UUID.randomUUID().toString().replace("-", "");
    JdbcKeyValueStore first = JdbcKeyValueStores.open(StoreConfig.of(PREFIX, 64, 64), cache);
    opened.add(first);
    first.put(b("a"), b("1"));

    JdbcKeyValueStore second = JdbcKeyValueStores.open(StoreConfig.of(PREFIX, 64, 64), cache);
    opened.add(second);
    assertEquals(b("1"), second.get(b("a")));
  }

  @Test
  void unreachableBackendFailsOpen() {
    JdbcKeyValueStore s = JdbcKeyValueStores.create(StoreConfig.of("h2://127.0.0.1:1/nothing", 16, 16));
    assertThrows(InitializationException.class, s::open);
    assertFalse(s.isOpen());
  }
}
