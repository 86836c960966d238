package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Quote;
import com.otcdesk.domain.deals.QuoteStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcQuoteStore implements QuoteStore {
  private static final String COLUMNS =
      """
      quote_id, chain, beneficiary, token_id, discount_bps, lockup_days, price_at_quote,
      expires_at, status, offer_id, created_at, version
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcQuoteStore(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void insert(Quote quote) {
    String sql =
        """
        INSERT INTO quotes (
            quote_id,
            chain,
            beneficiary,
            token_id,
            discount_bps,
            lockup_days,
            price_at_quote,
            expires_at,
            status,
            offer_id,
            created_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        quote.quoteId(),
        quote.chain().id(),
        quote.beneficiary(),
        quote.tokenId(),
        quote.discountBps(),
        quote.lockupDays(),
        quote.priceAtQuote(),
        Timestamp.from(quote.expiresAt()),
        quote.status().name(),
        quote.offerId(),
        Timestamp.from(quote.createdAt()));
  }

  @Override
  public Optional<StoredQuote> find(String quoteId) {
    String sql = "SELECT " + COLUMNS + " FROM quotes WHERE quote_id = ?";
    List<StoredQuote> rows = jdbcTemplate.query(sql, this::mapRow, quoteId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  @Override
  public List<StoredQuote> findPending(int limit) {
    String sql =
        "SELECT " + COLUMNS + " FROM quotes WHERE status = 'PENDING' ORDER BY expires_at LIMIT ?";
    return jdbcTemplate.query(sql, this::mapRow, limit);
  }

  @Override
  public ConditionalWrite updateStatus(String quoteId, long expectedVersion, QuoteStatus status) {
    String sql =
        """
        UPDATE quotes
        SET status = ?,
            version = version + 1,
            updated_at = NOW()
        WHERE quote_id = ? AND version = ?
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(sql, status.name(), quoteId, expectedVersion));
  }

  @Override
  public ConditionalWrite closePending(String quoteId, QuoteStatus status) {
    String sql =
        """
        UPDATE quotes
        SET status = ?,
            version = version + 1,
            updated_at = NOW()
        WHERE quote_id = ? AND status = 'PENDING'
        """;
    return ConditionalWrite.fromRowCount(jdbcTemplate.update(sql, status.name(), quoteId));
  }

  @Override
  public ConditionalWrite linkOffer(String quoteId, String offerId) {
    String sql =
        """
        UPDATE quotes
        SET offer_id = ?,
            version = version + 1,
            updated_at = NOW()
        WHERE quote_id = ? AND (offer_id IS NULL OR offer_id = ?)
        """;
    return ConditionalWrite.fromRowCount(jdbcTemplate.update(sql, offerId, quoteId, offerId));
  }

  private StoredQuote mapRow(ResultSet rs, int rowNum) throws SQLException {
    Quote quote =
        new Quote(
            rs.getString("quote_id"),
            Chain.fromId(rs.getString("chain")),
            rs.getString("beneficiary"),
            rs.getString("token_id"),
            rs.getInt("discount_bps"),
            rs.getInt("lockup_days"),
            rs.getBigDecimal("price_at_quote").stripTrailingZeros(),
            rs.getTimestamp("expires_at").toInstant(),
            QuoteStatus.valueOf(rs.getString("status")),
            rs.getString("offer_id"),
            rs.getTimestamp("created_at").toInstant());
    return new StoredQuote(quote, rs.getLong("version"));
  }
}
