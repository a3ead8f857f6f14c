package io.intellixity.ignitekv.spi.exec;

import io.intellixity.ignitekv.store.ByteArray;
import io.intellixity.ignitekv.store.WriteOp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A batch reduced to its final effect per key: one delete-set and one put-set.\n
 *
 * The last operation on a key wins; keys keep the order of their first appearance.
 */
public record BatchPlan(List<ByteArray> deletes, List<WriteOp.Put> puts) {
  public BatchPlan {
    deletes = List.copyOf(deletes);
    puts = List.copyOf(puts);
  }

  public static BatchPlan of(List<WriteOp> ops) {
    Objects.requireNonNull(ops, "ops");
    Map<ByteArray, WriteOp> last = new LinkedHashMap<>();
    for (WriteOp op : ops) {
      Objects.requireNonNull(op, "op");
      last.put(op.key(), op);
    }
    List<ByteArray> deletes = new ArrayList<>();
    List<WriteOp.Put> puts = new ArrayList<>();
    for (WriteOp op : last.values()) {
      if (op instanceof WriteOp.Put p) puts.add(p);
      else deletes.add(op.key());
    }
    return new BatchPlan(deletes, puts);
  }

  public boolean isEmpty() {
    return deletes.isEmpty() && puts.isEmpty();
  }
}
