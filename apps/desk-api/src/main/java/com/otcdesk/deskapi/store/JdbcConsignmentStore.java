package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Consignment;
import com.otcdesk.domain.deals.ConsignmentStatus;
import com.otcdesk.domain.deals.DealTerms;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcConsignmentStore implements ConsignmentStore {
  private static final String COLUMNS =
      """
      chain, consignment_id, token_id, consigner, total_amount, remaining_amount, negotiable,
      fixed_discount_bps, fixed_lockup_days, min_discount_bps, max_discount_bps,
      min_lockup_days, max_lockup_days, min_deal_amount, max_deal_amount,
      max_price_volatility_bps, max_time_to_execute_seconds, fractionalized, private_listing,
      status, ledger_created_at, version
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcConsignmentStore(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<StoredConsignment> find(Chain chain, String consignmentId) {
    String sql = "SELECT " + COLUMNS + " FROM consignments WHERE chain = ? AND consignment_id = ?";
    List<StoredConsignment> rows =
        jdbcTemplate.query(sql, this::mapRow, chain.id(), consignmentId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  @Override
  public StoredConsignment insertIfAbsent(Consignment consignment) {
    String sql =
        """
        INSERT INTO consignments (
            chain,
            consignment_id,
            token_id,
            consigner,
            total_amount,
            remaining_amount,
            negotiable,
            fixed_discount_bps,
            fixed_lockup_days,
            min_discount_bps,
            max_discount_bps,
            min_lockup_days,
            max_lockup_days,
            min_deal_amount,
            max_deal_amount,
            max_price_volatility_bps,
            max_time_to_execute_seconds,
            fractionalized,
            private_listing,
            status,
            ledger_created_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (chain, consignment_id) DO NOTHING
        """;
    DealTerms terms = consignment.terms();
    jdbcTemplate.update(
        sql,
        consignment.chain().id(),
        consignment.id(),
        consignment.tokenId(),
        consignment.consigner(),
        new BigDecimal(consignment.totalAmount()),
        new BigDecimal(consignment.remainingAmount()),
        terms.negotiable(),
        terms.fixedDiscountBps(),
        terms.fixedLockupDays(),
        terms.minDiscountBps(),
        terms.maxDiscountBps(),
        terms.minLockupDays(),
        terms.maxLockupDays(),
        new BigDecimal(terms.minDealAmount()),
        new BigDecimal(terms.maxDealAmount()),
        terms.maxPriceVolatilityBps(),
        terms.maxTimeToExecuteSeconds(),
        consignment.fractionalized(),
        consignment.privateListing(),
        consignment.status().name(),
        Timestamp.from(consignment.createdAt()));
    return find(consignment.chain(), consignment.id())
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "Consignment vanished after insert: " + consignment.id()));
  }

  @Override
  public List<StoredConsignment> findByFilter(
      Chain chain, ConsignmentStatus status, String consigner, int limit) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM consignments WHERE 1 = 1");
    List<Object> params = new ArrayList<>();
    if (chain != null) {
      sql.append(" AND chain = ?");
      params.add(chain.id());
    }
    if (status != null) {
      sql.append(" AND status = ?");
      params.add(status.name());
    }
    if (consigner != null) {
      sql.append(" AND consigner = ?");
      params.add(consigner);
    }
    sql.append(" ORDER BY ledger_created_at DESC LIMIT ?");
    params.add(limit);
    return jdbcTemplate.query(sql.toString(), this::mapRow, params.toArray());
  }

  @Override
  public List<StoredConsignment> findActive(int limit) {
    String sql =
        "SELECT "
            + COLUMNS
            + " FROM consignments WHERE status IN ('ACTIVE', 'PAUSED')"
            + " ORDER BY updated_at ASC LIMIT ?";
    return jdbcTemplate.query(sql, this::mapRow, limit);
  }

  @Override
  public ConditionalWrite updateLedgerState(
      Chain chain,
      String consignmentId,
      long expectedVersion,
      BigInteger remainingAmount,
      ConsignmentStatus status) {
    String sql =
        """
        UPDATE consignments
        SET remaining_amount = ?,
            status = ?,
            version = version + 1,
            updated_at = NOW()
        WHERE chain = ? AND consignment_id = ? AND version = ?
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(
            sql,
            new BigDecimal(remainingAmount),
            status.name(),
            chain.id(),
            consignmentId,
            expectedVersion));
  }

  private StoredConsignment mapRow(ResultSet rs, int rowNum) throws SQLException {
    DealTerms terms =
        new DealTerms(
            rs.getBoolean("negotiable"),
            rs.getInt("fixed_discount_bps"),
            rs.getInt("fixed_lockup_days"),
            rs.getInt("min_discount_bps"),
            rs.getInt("max_discount_bps"),
            rs.getInt("min_lockup_days"),
            rs.getInt("max_lockup_days"),
            rs.getBigDecimal("min_deal_amount").toBigIntegerExact(),
            rs.getBigDecimal("max_deal_amount").toBigIntegerExact(),
            rs.getInt("max_price_volatility_bps"),
            rs.getLong("max_time_to_execute_seconds"));
    Consignment consignment =
        new Consignment(
            Chain.fromId(rs.getString("chain")),
            rs.getString("consignment_id"),
            rs.getString("token_id"),
            rs.getString("consigner"),
            rs.getBigDecimal("total_amount").toBigIntegerExact(),
            rs.getBigDecimal("remaining_amount").toBigIntegerExact(),
            terms,
            rs.getBoolean("fractionalized"),
            rs.getBoolean("private_listing"),
            ConsignmentStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("ledger_created_at").toInstant());
    return new StoredConsignment(consignment, rs.getLong("version"));
  }
}
