package com.soldexhub.ingest.trade;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.Trade;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
public class JdbcTradeRepository implements TradeRepository {
  private static final String INSERT_SQL =
      """
      INSERT INTO trades (
          blk_ts,
          slot,
          txid,
          idx,
          mint,
          decimals,
          trader,
          dex,
          pool,
          is_buy,
          sol_amt,
          token_amt,
          price_sol
      ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      ON CONFLICT (txid, idx) DO NOTHING
      """;

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  public JdbcTradeRepository(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  public List<Trade> insertIgnoringConflicts(List<Trade> trades) {
    if (trades.isEmpty()) {
      return List.of();
    }
    List<Object[]> rows = new ArrayList<>(trades.size());
    for (Trade trade : trades) {
      rows.add(
          new Object[] {
            Timestamp.from(trade.blockTime()),
            trade.slot(),
            trade.txid(),
            trade.idx(),
            trade.mint(),
            trade.decimals(),
            trade.trader(),
            trade.dexKind().storageName(),
            trade.poolAddress(),
            trade.buy(),
            trade.solAmount(),
            trade.tokenAmount(),
            trade.priceSol()
          });
    }
    int[] counts = transactionTemplate.execute(status -> jdbcTemplate.batchUpdate(INSERT_SQL, rows));
    List<Trade> inserted = new ArrayList<>();
    for (int i = 0; i < trades.size(); i++) {
      if (counts != null && i < counts.length && counts[i] > 0) {
        inserted.add(trades.get(i));
      }
    }
    return inserted;
  }

  @Override
  public Optional<String> findLatestTxid(DexKind dex) {
    List<String> txids =
        jdbcTemplate.queryForList(
            """
            SELECT txid
            FROM trades
            WHERE dex = ?
            ORDER BY slot DESC, idx DESC
            LIMIT 1
            """,
            String.class,
            dex.storageName());
    return txids.stream().findFirst();
  }
}
