package com.otcdesk.deskapi.settlement;

import com.otcdesk.domain.deals.Chain;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;
import java.util.zip.CRC32;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Holds a PostgreSQL transaction-scoped advisory lock for the duration of one submission. */
@Component
public class AdvisoryLockSubmissionSequencer implements SubmissionSequencer {
  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  public AdvisoryLockSubmissionSequencer(
      JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
  }

  @Override
  public <T> T submit(Chain chain, String signer, Supplier<T> submission) {
    long lockKey = lockKey(chain, signer);
    return transactionTemplate.execute(
        status -> {
          jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", rs -> null, lockKey);
          return submission.get();
        });
  }

  static long lockKey(Chain chain, String signer) {
    CRC32 crc = new CRC32();
    crc.update(("signer:" + chain.id() + ":" + signer).getBytes(StandardCharsets.UTF_8));
    return crc.getValue();
  }
}
