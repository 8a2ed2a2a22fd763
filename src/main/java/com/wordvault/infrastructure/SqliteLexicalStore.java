package com.wordvault.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wordvault.application.port.LexicalStore;
import com.wordvault.application.port.RecordQuery;
import com.wordvault.application.port.RecordSlice;
import com.wordvault.application.port.StoreException;
import com.wordvault.domain.Entry;
import com.wordvault.domain.ExampleTranslation;
import com.wordvault.domain.IdiomMatch;
import com.wordvault.domain.LexicalRecord;
import com.wordvault.domain.SenseTranslation;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.sqlite.SQLiteConfig;

/**
 * Lexical store backed by a single SQLite table whose nested parts are JSON columns.
 *
 * <p>One row per canonical key; {@code entries}, {@code variants} and {@code parts_of_speech}
 * hold JSON arrays written by Jackson and queried with SQLite's {@code json_each}/{@code json_tree}.
 * Rowid order is insertion order and serves as the stable "scrape order" for idiom results.
 *
 * <p>All access goes through one JDBC connection guarded by a monitor. Read-modify-write
 * operations (merge, backfill) run inside one transaction while holding it, so concurrent merges
 * of the same key are serialized and cannot drop each other's entries. Prefix queries use LIKE
 * with an explicit ESCAPE clause and escaped user input.
 */
@Service
public class SqliteLexicalStore implements LexicalStore {
  private static final Logger log = LoggerFactory.getLogger(SqliteLexicalStore.class);

  private static final TypeReference<List<Entry>> ENTRY_LIST = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private static final String COLUMNS =
      "r.key, r.entries, r.variants, r.symbol, r.parts_of_speech, r.created_at, r.updated_at";

  private static final String SQL_CREATE =
      "CREATE TABLE IF NOT EXISTS lexical_record ("
          + " key TEXT PRIMARY KEY,"
          + " entries TEXT NOT NULL DEFAULT '[]',"
          + " variants TEXT NOT NULL DEFAULT '[]',"
          + " symbol TEXT NOT NULL DEFAULT '',"
          + " parts_of_speech TEXT NOT NULL DEFAULT '[]',"
          + " created_at TEXT NOT NULL,"
          + " updated_at TEXT NOT NULL)";
  private static final String SQL_INDEX_SYMBOL =
      "CREATE INDEX IF NOT EXISTS idx_lexical_record_symbol ON lexical_record(symbol)";

  private static final String SQL_BY_KEY =
      "SELECT " + COLUMNS + " FROM lexical_record r WHERE r.key = ?";
  private static final String SQL_BY_WORD =
      "SELECT " + COLUMNS + " FROM lexical_record r"
          + " WHERE r.key = ?"
          + " OR EXISTS (SELECT 1 FROM json_each(r.variants) v WHERE lower(v.value) = lower(?))"
          + " ORDER BY (r.key = ?) DESC, r.rowid LIMIT 1";
  private static final String SQL_UPSERT =
      "INSERT INTO lexical_record"
          + " (key, entries, variants, symbol, parts_of_speech, created_at, updated_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?)"
          + " ON CONFLICT(key) DO UPDATE SET"
          + " entries = excluded.entries, variants = excluded.variants, symbol = excluded.symbol,"
          + " parts_of_speech = excluded.parts_of_speech, updated_at = excluded.updated_at";
  private static final String SQL_HEADWORDS_BY_PREFIX =
      "SELECT DISTINCT json_extract(e.value, '$.headword') AS headword"
          + " FROM lexical_record r, json_each(r.entries) e"
          + " WHERE json_extract(e.value, '$.headword') LIKE ? ESCAPE '\\'"
          + " OR r.key LIKE ? ESCAPE '\\'"
          + " OR EXISTS (SELECT 1 FROM json_each(r.variants) v WHERE v.value LIKE ? ESCAPE '\\')"
          + " ORDER BY headword DESC";
  private static final String SQL_IDIOMS =
      "SELECT r.key, json_extract(e.value, '$.partOfSpeech'), json_extract(i.value, '$.idiomText')"
          + " FROM lexical_record r, json_each(r.entries) e, json_each(e.value, '$.idioms') i"
          + " ORDER BY r.rowid, e.key, i.key";
  private static final String SQL_PARTS_OF_SPEECH =
      "SELECT DISTINCT p.value FROM lexical_record r, json_each(r.parts_of_speech) p"
          + " WHERE p.value <> '' ORDER BY p.value";
  private static final String SQL_KEYS_WITH_ID =
      "SELECT DISTINCT r.key FROM lexical_record r, json_tree(r.entries) t"
          + " WHERE t.key = 'id' AND t.atom IN (%s) ORDER BY r.rowid";
  private static final String SQL_ENTRIES_BY_KEY =
      "SELECT entries FROM lexical_record WHERE key = ?";
  private static final String SQL_UPDATE_ENTRIES =
      "UPDATE lexical_record SET entries = ?, updated_at = ? WHERE key = ?";

  private final String jdbcUrl;
  private final ObjectMapper mapper;
  private final Object lock = new Object();

  private Connection conn;

  public SqliteLexicalStore(
      @Value("${wordvault.store-jdbc-url:jdbc:sqlite:wordvault.db}") String jdbcUrl, ObjectMapper mapper) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "wordvault.store-jdbc-url");
    this.mapper = mapper;
  }

  /**
   * Open the SQLite connection and create the schema if needed.
   *
   * <p>For file URLs the parent directory is created. The connection runs in auto-commit mode
   * outside explicit transactions, with these PRAGMAs:
   * - journal_mode=WAL
   * - busy_timeout=3000
   * - temp_store=MEMORY
   *
   * @throws Exception if connection or schema creation fails
   */
  @PostConstruct
  public void open() throws Exception {
    long t0 = System.nanoTime();
    try {
      if (jdbcUrl.startsWith("jdbc:sqlite:")) {
        String path = jdbcUrl.substring("jdbc:sqlite:".length());
        if (!path.isEmpty() && !path.startsWith(":") && !path.startsWith("file:")) {
          Path parent = Path.of(path).toAbsolutePath().normalize().getParent();
          if (parent != null) Files.createDirectories(parent);
        }
      }

      SQLiteConfig cfg = new SQLiteConfig();
      cfg.setJournalMode(SQLiteConfig.JournalMode.WAL);
      cfg.setBusyTimeout(3000);
      cfg.setTempStore(SQLiteConfig.TempStore.MEMORY);

      conn = DriverManager.getConnection(jdbcUrl, cfg.toProperties());
      conn.setAutoCommit(true);

      try (Statement s = conn.createStatement()) {
        s.execute(SQL_CREATE);
        s.execute(SQL_INDEX_SYMBOL);
      }

      long ms = (System.nanoTime() - t0) / 1_000_000;
      log.info("Lexical store ready at {} ({} ms).", jdbcUrl, ms);
    } catch (Exception e) {
      close();
      throw e;
    }
  }

  /** Close the SQLite connection. */
  @PreDestroy
  public void close() {
    synchronized (lock) {
      if (conn == null) return;
      try {
        conn.close();
      } catch (SQLException e) {
        log.warn("Closing lexical store failed: {}", e.getMessage());
      }
      conn = null;
    }
  }

  @Override
  public Optional<LexicalRecord> findByKey(String key) {
    return read("findByKey", () -> Optional.ofNullable(selectByKey(key)));
  }

  @Override
  public Optional<LexicalRecord> findByWord(String key, String spelling) {
    return read(
        "findByWord",
        () -> {
          try (PreparedStatement ps = conn.prepareStatement(SQL_BY_WORD)) {
            ps.setString(1, key);
            ps.setString(2, spelling == null ? key : spelling.trim());
            ps.setString(3, key);
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next() ? Optional.of(readRecord(rs)) : Optional.<LexicalRecord>empty();
            }
          }
        });
  }

  @Override
  public LexicalRecord update(String key, UnaryOperator<LexicalRecord> merge) {
    return inTransaction(
        "update",
        () -> {
          LexicalRecord existing = selectByKey(key);
          LexicalRecord next = merge.apply(existing);
          Instant now = Instant.now();
          LexicalRecord stored =
              new LexicalRecord(
                  key,
                  next.entries(),
                  next.variants(),
                  next.symbol(),
                  next.partsOfSpeech(),
                  existing != null && existing.createdAt() != null ? existing.createdAt() : now,
                  now);
          upsertRow(stored);
          log.info(
              "{} '{}' ({} entries, {} variants)",
              existing == null ? "Created" : "Updated",
              key,
              stored.entries().size(),
              stored.variants().size());
          return stored;
        });
  }

  @Override
  public List<String> headwordsByPrefix(String prefix) {
    String like = escapeLike(prefix == null ? "" : prefix) + "%";
    return read(
        "headwordsByPrefix",
        () -> {
          List<String> out = new ArrayList<>();
          try (PreparedStatement ps = conn.prepareStatement(SQL_HEADWORDS_BY_PREFIX)) {
            ps.setString(1, like);
            ps.setString(2, like);
            ps.setString(3, like);
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                String h = rs.getString(1);
                if (h != null) out.add(h);
              }
            }
          }
          return out;
        });
  }

  @Override
  public List<IdiomMatch> idioms(Pattern pattern) {
    return read(
        "idioms",
        () -> {
          List<IdiomMatch> out = new ArrayList<>();
          try (PreparedStatement ps = conn.prepareStatement(SQL_IDIOMS);
              ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
              String text = rs.getString(3);
              if (text == null || !pattern.matcher(text).find()) continue;
              String pos = rs.getString(2);
              out.add(new IdiomMatch(text, pos == null ? "" : pos, rs.getString(1)));
            }
          }
          return out;
        });
  }

  @Override
  public RecordSlice list(RecordQuery query, int offset, int limit) {
    StringBuilder where = new StringBuilder(" WHERE 1 = 1");
    List<String> params = new ArrayList<>();
    if (query.keyPrefix() != null && !query.keyPrefix().isEmpty()) {
      where.append(" AND r.key LIKE ? ESCAPE '\\'");
      params.add(escapeLike(query.keyPrefix()) + "%");
    }
    if (query.symbol() != null && !query.symbol().isEmpty()) {
      where.append(" AND r.symbol = ?");
      params.add(query.symbol());
    }
    if (query.partOfSpeech() != null && !query.partOfSpeech().isEmpty()) {
      where.append(" AND EXISTS (SELECT 1 FROM json_each(r.parts_of_speech) p WHERE p.value = ?)");
      params.add(query.partOfSpeech());
    }
    String countSql = "SELECT COUNT(*) FROM lexical_record r" + where;
    String pageSql =
        "SELECT " + COLUMNS + " FROM lexical_record r" + where + " ORDER BY r.key LIMIT ? OFFSET ?";

    return read(
        "list",
        () -> {
          long total;
          try (PreparedStatement ps = conn.prepareStatement(countSql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
              total = rs.next() ? rs.getLong(1) : 0;
            }
          }
          List<LexicalRecord> records = new ArrayList<>();
          try (PreparedStatement ps = conn.prepareStatement(pageSql)) {
            bind(ps, params);
            ps.setInt(params.size() + 1, limit);
            ps.setInt(params.size() + 2, offset);
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) records.add(readRecord(rs));
            }
          }
          return new RecordSlice(total, records);
        });
  }

  @Override
  public List<String> partsOfSpeech() {
    return read(
        "partsOfSpeech",
        () -> {
          List<String> out = new ArrayList<>();
          try (PreparedStatement ps = conn.prepareStatement(SQL_PARTS_OF_SPEECH);
              ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(rs.getString(1));
          }
          return out;
        });
  }

  @Override
  public int fillExampleTranslation(String exampleId, String translatedText) {
    return inTransaction(
        "fillExampleTranslation",
        () -> patchRecords(
            List.of(exampleId),
            entries -> NestedDocuments.fillExample(entries, exampleId, translatedText)));
  }

  @Override
  public int fillSenseTranslation(String senseId, String definition, String definitionShort) {
    return inTransaction(
        "fillSenseTranslation",
        () -> patchRecords(
            List.of(senseId),
            entries -> NestedDocuments.fillSense(entries, senseId, definition, definitionShort)));
  }

  @Override
  public List<ExampleTranslation> exampleTranslations(Collection<String> exampleIds) {
    if (exampleIds.isEmpty()) return List.of();
    Set<String> wanted = new LinkedHashSet<>(exampleIds);
    return read(
        "exampleTranslations",
        () -> {
          Map<String, ExampleTranslation> found = new LinkedHashMap<>();
          for (String key : keysWithIds(wanted)) {
            for (ObjectNode ex : NestedDocuments.examples(selectEntriesTree(key))) {
              String id = ex.path(NestedDocuments.ID).asText();
              if (wanted.contains(id)) {
                found.putIfAbsent(
                    id,
                    new ExampleTranslation(
                        id, ex.path(NestedDocuments.TRANSLATED_TEXT).asText("")));
              }
            }
          }
          return inRequestOrder(wanted, found);
        });
  }

  @Override
  public List<SenseTranslation> senseTranslations(Collection<String> senseIds) {
    if (senseIds.isEmpty()) return List.of();
    Set<String> wanted = new LinkedHashSet<>(senseIds);
    return read(
        "senseTranslations",
        () -> {
          Map<String, SenseTranslation> found = new LinkedHashMap<>();
          for (String key : keysWithIds(wanted)) {
            for (ObjectNode s : NestedDocuments.senses(selectEntriesTree(key))) {
              String id = s.path(NestedDocuments.ID).asText();
              if (wanted.contains(id)) {
                found.putIfAbsent(
                    id,
                    new SenseTranslation(
                        id,
                        s.path(NestedDocuments.DEFINITION_TRANSLATED).asText(""),
                        s.path(NestedDocuments.DEFINITION_TRANSLATED_SHORT).asText("")));
              }
            }
          }
          return inRequestOrder(wanted, found);
        });
  }

  // Helpers

  @FunctionalInterface
  private interface SqlWork<T> {
    T run() throws SQLException, IOException;
  }

  @FunctionalInterface
  private interface TreePatch {
    int apply(JsonNode entries);
  }

  /** Run a read under the connection monitor, translating failures to {@link StoreException}. */
  private <T> T read(String op, SqlWork<T> work) {
    synchronized (lock) {
      requireOpen();
      try {
        return work.run();
      } catch (SQLException | IOException e) {
        log.debug("{} failed: {}", op, e.getMessage());
        throw new StoreException(op + " failed", e);
      }
    }
  }

  /** Run {@code work} in one transaction under the connection monitor; roll back on any failure. */
  private <T> T inTransaction(String op, SqlWork<T> work) {
    synchronized (lock) {
      requireOpen();
      try {
        conn.setAutoCommit(false);
        T result = work.run();
        conn.commit();
        return result;
      } catch (SQLException | IOException e) {
        rollback(op);
        throw new StoreException(op + " failed", e);
      } catch (RuntimeException e) {
        rollback(op);
        throw e;
      } finally {
        try {
          conn.setAutoCommit(true);
        } catch (SQLException e) {
          log.warn("{}: restoring auto-commit failed: {}", op, e.getMessage());
        }
      }
    }
  }

  private void rollback(String op) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      log.warn("{}: rollback failed: {}", op, e.getMessage());
    }
  }

  private void requireOpen() {
    if (conn == null) throw new IllegalStateException("Lexical store is not open");
  }

  /**
   * Apply {@code patch} to the entries of every record that mentions one of {@code ids}; write back
   * only the records it changed.
   *
   * @return total count reported by the patch
   */
  private int patchRecords(Collection<String> ids, TreePatch patch)
      throws SQLException, IOException {
    int total = 0;
    String now = Instant.now().toString();
    for (String key : keysWithIds(ids)) {
      JsonNode tree = selectEntriesTree(key);
      int n = patch.apply(tree);
      if (n == 0) continue;
      try (PreparedStatement ps = conn.prepareStatement(SQL_UPDATE_ENTRIES)) {
        ps.setString(1, mapper.writeValueAsString(tree));
        ps.setString(2, now);
        ps.setString(3, key);
        ps.executeUpdate();
      }
      log.debug("Patched {} location(s) in '{}'", n, key);
      total += n;
    }
    return total;
  }

  /** Keys of records whose entry tree has an {@code id} member equal to one of {@code ids}. */
  private List<String> keysWithIds(Collection<String> ids) throws SQLException {
    String marks = String.join(", ", Collections.nCopies(ids.size(), "?"));
    List<String> keys = new ArrayList<>();
    try (PreparedStatement ps = conn.prepareStatement(String.format(SQL_KEYS_WITH_ID, marks))) {
      bind(ps, ids);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) keys.add(rs.getString(1));
      }
    }
    return keys;
  }

  private JsonNode selectEntriesTree(String key) throws SQLException, IOException {
    try (PreparedStatement ps = conn.prepareStatement(SQL_ENTRIES_BY_KEY)) {
      ps.setString(1, key);
      try (ResultSet rs = ps.executeQuery()) {
        return mapper.readTree(rs.next() ? rs.getString(1) : "[]");
      }
    }
  }

  private LexicalRecord selectByKey(String key) throws SQLException, IOException {
    try (PreparedStatement ps = conn.prepareStatement(SQL_BY_KEY)) {
      ps.setString(1, key);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? readRecord(rs) : null;
      }
    }
  }

  private void upsertRow(LexicalRecord r) throws SQLException, JsonProcessingException {
    try (PreparedStatement ps = conn.prepareStatement(SQL_UPSERT)) {
      ps.setString(1, r.key());
      ps.setString(2, mapper.writeValueAsString(r.entries()));
      ps.setString(3, mapper.writeValueAsString(r.variants()));
      ps.setString(4, r.symbol());
      ps.setString(5, mapper.writeValueAsString(r.partsOfSpeech()));
      ps.setString(6, r.createdAt().toString());
      ps.setString(7, r.updatedAt().toString());
      ps.executeUpdate();
    }
  }

  private LexicalRecord readRecord(ResultSet rs) throws SQLException, IOException {
    return new LexicalRecord(
        rs.getString(1),
        mapper.readValue(rs.getString(2), ENTRY_LIST),
        new LinkedHashSet<>(mapper.readValue(rs.getString(3), STRING_LIST)),
        rs.getString(4),
        mapper.readValue(rs.getString(5), STRING_LIST),
        Instant.parse(rs.getString(6)),
        Instant.parse(rs.getString(7)));
  }

  private static void bind(PreparedStatement ps, Collection<String> params) throws SQLException {
    int i = 1;
    for (String p : params) ps.setString(i++, p);
  }

  private static <T> List<T> inRequestOrder(Set<String> wanted, Map<String, T> found) {
    List<T> out = new ArrayList<>();
    for (String id : wanted) {
      T t = found.get(id);
      if (t != null) out.add(t);
    }
    return out;
  }

  /** Escape special LIKE wildcard characters in user input. */
  private static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
