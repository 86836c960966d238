package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Offer;
import com.otcdesk.domain.deals.OfferFlags;
import com.otcdesk.domain.deals.OfferStatus;
import com.otcdesk.domain.deals.PaymentCurrency;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOfferStore implements OfferStore {
  private static final String COLUMNS =
      """
      chain, offer_id, consignment_id, token_id, beneficiary, token_amount, discount_bps,
      lockup_seconds, currency, price_usd_8d, native_usd_8d, ledger_created_at,
      approved, paid, fulfilled, cancelled, quote_id, payment_amount, last_tx_hash,
      claim_token, claim_stage, claim_expires_at, pending_tx_hash,
      last_rejection, last_rejection_detail, version, updated_at
      """;

  // Flags are OR-merged against the current row; the status follows the merged flags.
  private static final String MERGED_FLAGS =
      """
      approved = approved OR ?,
      paid = paid OR ?,
      fulfilled = fulfilled OR ?,
      cancelled = cancelled OR ?,
      status = CASE
          WHEN cancelled OR ? THEN 'CANCELLED'
          WHEN fulfilled OR ? THEN 'FULFILLED'
          WHEN paid OR ? THEN 'PAID'
          WHEN approved OR ? THEN 'APPROVED'
          ELSE 'CREATED'
      END
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcOfferStore(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<StoredOffer> find(Chain chain, String offerId) {
    String sql = "SELECT " + COLUMNS + " FROM offers WHERE chain = ? AND offer_id = ?";
    List<StoredOffer> rows = jdbcTemplate.query(sql, this::mapRow, chain.id(), offerId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  @Override
  public StoredOffer insertIfAbsent(Offer offer, String quoteId) {
    String sql =
        """
        INSERT INTO offers (
            chain,
            offer_id,
            consignment_id,
            token_id,
            beneficiary,
            token_amount,
            discount_bps,
            lockup_seconds,
            currency,
            price_usd_8d,
            native_usd_8d,
            ledger_created_at,
            approved,
            paid,
            fulfilled,
            cancelled,
            status,
            quote_id
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (chain, offer_id) DO NOTHING
        """;
    OfferFlags flags = offer.flags();
    jdbcTemplate.update(
        sql,
        offer.chain().id(),
        offer.id(),
        offer.consignmentId(),
        offer.tokenId(),
        offer.beneficiary(),
        new BigDecimal(offer.tokenAmount()),
        offer.discountBps(),
        offer.lockupSeconds(),
        offer.currency().name(),
        new BigDecimal(offer.priceUsdPerToken8d()),
        new BigDecimal(offer.nativeUsdPrice8d()),
        Timestamp.from(offer.createdAt()),
        flags.approved(),
        flags.paid(),
        flags.fulfilled(),
        flags.cancelled(),
        flags.status().name(),
        quoteId);
    return find(offer.chain(), offer.id())
        .orElseThrow(() -> new IllegalStateException("Offer vanished after insert: " + offer.id()));
  }

  @Override
  public List<StoredOffer> findByFilter(
      Chain chain, OfferStatus status, String beneficiary, int limit) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM offers WHERE 1 = 1");
    List<Object> params = new ArrayList<>();
    if (chain != null) {
      sql.append(" AND chain = ?");
      params.add(chain.id());
    }
    if (status != null) {
      sql.append(" AND status = ?");
      params.add(status.name());
    }
    if (beneficiary != null) {
      sql.append(" AND beneficiary = ?");
      params.add(beneficiary);
    }
    sql.append(" ORDER BY ledger_created_at DESC LIMIT ?");
    params.add(limit);
    return jdbcTemplate.query(sql.toString(), this::mapRow, params.toArray());
  }

  @Override
  public List<StoredOffer> findActive(int limit) {
    String sql =
        "SELECT "
            + COLUMNS
            + " FROM offers WHERE NOT fulfilled AND NOT cancelled ORDER BY updated_at ASC LIMIT ?";
    return jdbcTemplate.query(sql, this::mapRow, limit);
  }

  @Override
  public ConditionalWrite mergeFlags(
      Chain chain, String offerId, long expectedVersion, OfferFlags flags) {
    String sql =
        "UPDATE offers SET "
            + MERGED_FLAGS
            + """
            , version = version + 1,
              updated_at = NOW()
            WHERE chain = ? AND offer_id = ? AND version = ?
            """;
    List<Object> params = flagParams(flags);
    params.add(chain.id());
    params.add(offerId);
    params.add(expectedVersion);
    return ConditionalWrite.fromRowCount(jdbcTemplate.update(sql, params.toArray()));
  }

  @Override
  public ConditionalWrite linkQuote(
      Chain chain, String offerId, long expectedVersion, String quoteId) {
    String sql =
        """
        UPDATE offers
        SET quote_id = ?,
            version = version + 1,
            updated_at = NOW()
        WHERE chain = ? AND offer_id = ? AND version = ?
          AND (quote_id IS NULL OR quote_id = ?)
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(sql, quoteId, chain.id(), offerId, expectedVersion, quoteId));
  }

  @Override
  public ConditionalWrite acquireClaim(
      Chain chain, String offerId, long expectedVersion, SettlementClaim claim, Instant now) {
    String sql =
        """
        UPDATE offers
        SET claim_token = ?,
            claim_stage = ?,
            claim_expires_at = ?,
            pending_tx_hash = NULL,
            version = version + 1,
            updated_at = NOW()
        WHERE chain = ? AND offer_id = ? AND version = ?
          AND (claim_token IS NULL OR claim_expires_at <= ?)
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(
            sql,
            claim.token(),
            claim.stage().name(),
            Timestamp.from(claim.expiresAt()),
            chain.id(),
            offerId,
            expectedVersion,
            Timestamp.from(now)));
  }

  @Override
  public ConditionalWrite recordPendingTx(
      Chain chain, String offerId, UUID claimToken, ClaimStage stage, String txHash) {
    String sql =
        """
        UPDATE offers
        SET claim_stage = ?,
            pending_tx_hash = ?,
            version = version + 1,
            updated_at = NOW()
        WHERE chain = ? AND offer_id = ? AND claim_token = ?
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(sql, stage.name(), txHash, chain.id(), offerId, claimToken));
  }

  @Override
  public ConditionalWrite advanceClaim(
      Chain chain,
      String offerId,
      UUID claimToken,
      OfferFlags confirmedFlags,
      String txHash,
      ClaimStage nextStage) {
    String sql =
        "UPDATE offers SET "
            + MERGED_FLAGS
            + """
            , last_tx_hash = COALESCE(?, last_tx_hash),
              claim_stage = ?,
              pending_tx_hash = NULL,
              version = version + 1,
              updated_at = NOW()
            WHERE chain = ? AND offer_id = ? AND claim_token = ?
            """;
    List<Object> params = flagParams(confirmedFlags);
    params.add(txHash);
    params.add(nextStage.name());
    params.add(chain.id());
    params.add(offerId);
    params.add(claimToken);
    return ConditionalWrite.fromRowCount(jdbcTemplate.update(sql, params.toArray()));
  }

  @Override
  public ConditionalWrite markPaid(Chain chain, String offerId, UUID claimToken) {
    String sql =
        """
        UPDATE offers
        SET approved = TRUE,
            paid = TRUE,
            version = version + 1,
            updated_at = NOW()
        WHERE chain = ? AND offer_id = ? AND claim_token = ? AND NOT paid
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(sql, chain.id(), offerId, claimToken));
  }

  @Override
  public ConditionalWrite completeClaim(
      Chain chain,
      String offerId,
      UUID claimToken,
      OfferFlags confirmedFlags,
      String txHash,
      BigInteger paymentAmount) {
    String sql =
        "UPDATE offers SET "
            + MERGED_FLAGS
            + """
            , last_tx_hash = COALESCE(?, last_tx_hash),
              payment_amount = COALESCE(?, payment_amount),
              claim_token = NULL,
              claim_stage = NULL,
              claim_expires_at = NULL,
              pending_tx_hash = NULL,
              version = version + 1,
              updated_at = NOW()
            WHERE chain = ? AND offer_id = ? AND claim_token = ?
            """;
    List<Object> params = flagParams(confirmedFlags);
    params.add(txHash);
    params.add(paymentAmount == null ? null : new BigDecimal(paymentAmount));
    params.add(chain.id());
    params.add(offerId);
    params.add(claimToken);
    return ConditionalWrite.fromRowCount(jdbcTemplate.update(sql, params.toArray()));
  }

  @Override
  public ConditionalWrite recordRejection(
      Chain chain, String offerId, UUID claimToken, String reason, String detail, Instant at) {
    String sql =
        """
        UPDATE offers
        SET last_rejection = ?,
            last_rejection_detail = ?,
            last_rejection_at = ?,
            claim_token = NULL,
            claim_stage = NULL,
            claim_expires_at = NULL,
            pending_tx_hash = NULL,
            version = version + 1,
            updated_at = NOW()
        WHERE chain = ? AND offer_id = ? AND claim_token = ?
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(
            sql, reason, detail, Timestamp.from(at), chain.id(), offerId, claimToken));
  }

  @Override
  public ConditionalWrite releaseClaim(Chain chain, String offerId, UUID claimToken) {
    String sql =
        """
        UPDATE offers
        SET claim_token = NULL,
            claim_stage = NULL,
            claim_expires_at = NULL,
            version = version + 1,
            updated_at = NOW()
        WHERE chain = ? AND offer_id = ? AND claim_token = ?
        """;
    return ConditionalWrite.fromRowCount(
        jdbcTemplate.update(sql, chain.id(), offerId, claimToken));
  }

  private static List<Object> flagParams(OfferFlags flags) {
    List<Object> params = new ArrayList<>();
    params.add(flags.approved());
    params.add(flags.paid());
    params.add(flags.fulfilled());
    params.add(flags.cancelled());
    params.add(flags.cancelled());
    params.add(flags.fulfilled());
    params.add(flags.paid());
    params.add(flags.approved());
    return params;
  }

  private StoredOffer mapRow(ResultSet rs, int rowNum) throws SQLException {
    Offer offer =
        new Offer(
            Chain.fromId(rs.getString("chain")),
            rs.getString("offer_id"),
            rs.getString("consignment_id"),
            rs.getString("token_id"),
            rs.getString("beneficiary"),
            rs.getBigDecimal("token_amount").toBigIntegerExact(),
            rs.getInt("discount_bps"),
            rs.getLong("lockup_seconds"),
            PaymentCurrency.valueOf(rs.getString("currency")),
            rs.getBigDecimal("price_usd_8d").toBigIntegerExact(),
            rs.getBigDecimal("native_usd_8d").toBigIntegerExact(),
            rs.getTimestamp("ledger_created_at").toInstant(),
            new OfferFlags(
                rs.getBoolean("approved"),
                rs.getBoolean("paid"),
                rs.getBoolean("fulfilled"),
                rs.getBoolean("cancelled")));
    BigDecimal paymentAmount = rs.getBigDecimal("payment_amount");
    return new StoredOffer(
        offer,
        rs.getString("quote_id"),
        paymentAmount == null ? null : paymentAmount.toBigIntegerExact(),
        rs.getString("last_tx_hash"),
        mapClaim(rs),
        rs.getString("last_rejection"),
        rs.getString("last_rejection_detail"),
        rs.getLong("version"),
        rs.getTimestamp("updated_at").toInstant());
  }

  private static SettlementClaim mapClaim(ResultSet rs) throws SQLException {
    UUID token = rs.getObject("claim_token", UUID.class);
    if (token == null) {
      return null;
    }
    return new SettlementClaim(
        token,
        ClaimStage.valueOf(rs.getString("claim_stage")),
        rs.getTimestamp("claim_expires_at").toInstant(),
        rs.getString("pending_tx_hash"));
  }
}
