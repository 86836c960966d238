package com.otcdesk.deskapi.store;

import com.otcdesk.domain.deals.Chain;
import com.otcdesk.domain.deals.Token;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTokenRepository implements TokenRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcTokenRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void upsert(Token token) {
    String sql =
        """
        INSERT INTO tokens (chain, ledger_token_id, contract_address, symbol, decimals)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (chain, ledger_token_id) DO UPDATE
        SET contract_address = EXCLUDED.contract_address,
            symbol = EXCLUDED.symbol,
            decimals = EXCLUDED.decimals,
            updated_at = NOW()
        """;
    jdbcTemplate.update(
        sql,
        token.chain().id(),
        token.ledgerTokenId(),
        token.contractAddress(),
        token.symbol(),
        token.decimals());
  }

  @Override
  public Optional<Token> find(Chain chain, String ledgerTokenId) {
    String sql =
        """
        SELECT chain, ledger_token_id, contract_address, symbol, decimals
        FROM tokens
        WHERE chain = ? AND ledger_token_id = ?
        """;
    List<Token> rows = jdbcTemplate.query(sql, this::mapRow, chain.id(), ledgerTokenId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  @Override
  public List<Token> findByChain(Chain chain) {
    String sql =
        """
        SELECT chain, ledger_token_id, contract_address, symbol, decimals
        FROM tokens
        WHERE chain = ?
        ORDER BY symbol, ledger_token_id
        """;
    return jdbcTemplate.query(sql, this::mapRow, chain.id());
  }

  private Token mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Token(
        Chain.fromId(rs.getString("chain")),
        rs.getString("ledger_token_id"),
        rs.getString("contract_address"),
        rs.getString("symbol"),
        rs.getInt("decimals"));
  }
}
