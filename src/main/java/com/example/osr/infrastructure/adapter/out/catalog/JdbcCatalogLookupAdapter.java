package com.example.osr.infrastructure.adapter.out.catalog;

import com.example.osr.application.exception.StorageException;
import com.example.osr.application.port.out.CatalogLookupPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Looks up product codes in the OSR's {@code product_infos} table.
 */
@Component
@ConditionalOnProperty(name = "osr.catalog.enabled", havingValue = "true")
public class JdbcCatalogLookupAdapter implements CatalogLookupPort {

    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogLookupAdapter.class);

    private static final String LOOKUP_SQL =
            "SELECT pri_code, pri_name FROM product_infos WHERE pri_code = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcCatalogLookupAdapter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<CatalogDescriptor> lookup(String code) {
        try {
            List<CatalogDescriptor> matches = jdbcTemplate.query(LOOKUP_SQL,
                    (rs, rowNum) -> new CatalogDescriptor(rs.getString("pri_code"), rs.getString("pri_name")),
                    code);
            log.debug("Catalog lookup of {} matched {} product(s)", code, matches.size());
            return matches.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Catalog lookup failed for " + code, e);
        }
    }
}
