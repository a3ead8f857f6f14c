package io.intellixity.ignitekv.examples.service;

import io.intellixity.ignitekv.store.*;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** UTF-8 text facade over the byte-oriented store. */
@Service
public final class KvService {
  private final KeyValueStore store;

  public KvService(KeyValueStore store) {
    this.store = store;
  }

  public record Entry(String key, String value) {}

  public record BatchEntry(String type, String key, String value) {}

  public String get(String key) {
    return store.get(ByteArray.utf8(key)).toUtf8();
  }

  public void put(String key, String value) {
    store.put(ByteArray.utf8(key), ByteArray.utf8(value));
  }

  public void delete(String key) {
    store.delete(ByteArray.utf8(key));
  }

  public void batch(List<BatchEntry> entries) {
    List<WriteOp> ops = new ArrayList<>(entries.size());
    for (BatchEntry e : entries) {
      if (e == null || e.type() == null) throw new IllegalArgumentException("batch entry requires a type");
      if (e.key() == null) throw new IllegalArgumentException("batch entry requires a key");
      switch (e.type().toLowerCase(Locale.ROOT)) {
        case "put" -> {
          if (e.value() == null) throw new IllegalArgumentException("put entry requires a value: " + e.key());
          ops.add(WriteOp.put(ByteArray.utf8(e.key()), ByteArray.utf8(e.value())));
        }
        case "del" -> ops.add(WriteOp.delete(ByteArray.utf8(e.key())));
        default -> throw new IllegalArgumentException("Unknown batch entry type: " + e.type());
      }
    }
    store.batch(ops);
  }

  public List<Entry> range(RangeQuery query) {
    List<Entry> out = new ArrayList<>();
    try (CloseableIterator<KeyValue> it = store.iterator(query)) {
      while (it.hasNext()) {
        KeyValue kv = it.next();
        out.add(new Entry(kv.key().toUtf8(), kv.value().toUtf8()));
      }
    }
    return out;
  }
}
