package com.soldexhub.ingest.pool;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.PoolMetadata;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPoolRepository implements PoolRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcPoolRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean insertIfAbsent(PoolMetadata pool) {
    int updated =
        jdbcTemplate.update(
            """
            INSERT INTO pools (
                addr,
                dex,
                mint_a,
                mint_b,
                decimals_a,
                decimals_b
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (addr) DO NOTHING
            """,
            pool.address(),
            pool.dexKind().storageName(),
            pool.mintA(),
            pool.mintB(),
            pool.decimalsA(),
            pool.decimalsB());
    return updated > 0;
  }

  @Override
  public Optional<PoolMetadata> findByAddress(String address) {
    List<PoolMetadata> rows =
        jdbcTemplate.query(
            """
            SELECT addr, dex, mint_a, mint_b, decimals_a, decimals_b
            FROM pools
            WHERE addr = ?
            """,
            (rs, rowNum) -> mapRow(rs),
            address);
    return rows.stream().findFirst();
  }

  @Override
  public List<PoolMetadata> findRecent(int limit) {
    return jdbcTemplate.query(
        """
        SELECT addr, dex, mint_a, mint_b, decimals_a, decimals_b
        FROM pools
        ORDER BY created_at DESC
        LIMIT ?
        """,
        (rs, rowNum) -> mapRow(rs),
        Math.max(0, limit));
  }

  private static PoolMetadata mapRow(ResultSet rs) throws SQLException {
    return new PoolMetadata(
        rs.getString("addr"),
        DexKind.fromStorageName(rs.getString("dex")),
        rs.getString("mint_a"),
        rs.getString("mint_b"),
        rs.getInt("decimals_a"),
        rs.getInt("decimals_b"));
  }
}
