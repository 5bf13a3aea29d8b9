package org.caureq.fleetcore.service;

import org.caureq.fleetcore.repo.DomainMappingRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@DisplayName("DomainService")
class DomainServiceTest {

    @Autowired private DomainMappingRepo repo;

    private DomainService domains;

    @BeforeEach
    void setUp() {
        domains = new DomainService(repo);
    }

    @Test
    @DisplayName("a mapping is stored lower-cased and pending")
    void add() {
        var d = domains.add("Shop.Example.COM", "shop", true);

        assertThat(d.getCustomDomain()).isEqualTo("shop.example.com");
        assertThat(d.getStatus()).isEqualTo("pending");
        assertThat(d.isSslEnabled()).isTrue();
        assertThat(domains.list()).hasSize(1);
    }

    @Test
    @DisplayName("malformed and duplicate domains are refused")
    void validation() {
        domains.add("shop.example.com", "shop", false);

        assertThatThrownBy(() -> domains.add("SHOP.example.com", "other", false)).hasMessageContaining("already mapped");
        assertThatThrownBy(() -> domains.add("not a domain", "shop", false)).hasMessageContaining("invalid domain");
        assertThatThrownBy(() -> domains.add("blog.example.com", "-bad", false)).hasMessageContaining("invalid target");
    }
}
