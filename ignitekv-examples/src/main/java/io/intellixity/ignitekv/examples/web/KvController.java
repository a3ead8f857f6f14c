package io.intellixity.ignitekv.examples.web;

import io.intellixity.ignitekv.examples.service.KvService;
import io.intellixity.ignitekv.store.RangeQuery;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/kv")
public final class KvController {
  private final KvService kv;

  public KvController(KvService kv) {
    this.kv = kv;
  }

  @GetMapping("/{key}")
  public String get(@PathVariable("key") String key) {
    return kv.get(key);
  }

  @PutMapping("/{key}")
  public ResponseEntity<Void> put(@PathVariable("key") String key, @RequestBody String value) {
    kv.put(key, value);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{key}")
  public ResponseEntity<Void> delete(@PathVariable("key") String key) {
    kv.delete(key);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/batch")
  public ResponseEntity<Void> batch(@RequestBody List<KvService.BatchEntry> entries) {
    kv.batch(entries);
    return ResponseEntity.noContent().build();
  }

  @GetMapping
  public List<KvService.Entry> range(@RequestParam(value = "gt", required = false) String gt,
                                     @RequestParam(value = "gte", required = false) String gte,
                                     @RequestParam(value = "lt", required = false) String lt,
                                     @RequestParam(value = "lte", required = false) String lte,
                                     @RequestParam(value = "reverse", defaultValue = "false") boolean reverse,
                                     @RequestParam(value = "limit", defaultValue = "-1") int limit) {
    RangeQuery.Builder b = RangeQuery.builder().reverse(reverse).limit(limit);
    if (gt != null) b.gt(gt);
    if (gte != null) b.gte(gte);
    if (lt != null) b.lt(lt);
    if (lte != null) b.lte(lte);
    return kv.range(b.build());
  }
}
