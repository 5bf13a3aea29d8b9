package org.caureq.fleetcore.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.domain.DomainMapping;
import org.caureq.fleetcore.repo.DomainMappingRepo;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class DomainService {
    private static final Pattern FQDN = Pattern.compile(
            "^(?=.{1,253}$)([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,63}$");
    private static final Pattern LABEL = Pattern.compile("^[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?$");

    private final DomainMappingRepo repo;

    public List<DomainMapping> list() {
        return repo.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    public DomainMapping add(String customDomain, String targetSubdomain, boolean sslEnabled) {
        var domain = customDomain == null ? "" : customDomain.trim().toLowerCase(Locale.ROOT);
        var sub = targetSubdomain == null ? "" : targetSubdomain.trim().toLowerCase(Locale.ROOT);
        if (!FQDN.matcher(domain).matches()) throw new IllegalArgumentException("invalid domain name: " + customDomain);
        if (!LABEL.matcher(sub).matches()) throw new IllegalArgumentException("invalid target subdomain: " + targetSubdomain);
        if (repo.existsByCustomDomainIgnoreCase(domain)) throw new IllegalArgumentException("domain already mapped: " + domain);
        var saved = repo.save(DomainMapping.builder()
                .customDomain(domain)
                .targetSubdomain(sub)
                .sslEnabled(sslEnabled)
                .status("pending")
                .build());
        log.info("[Domains] mapped {} -> {}", domain, sub);
        return saved;
    }
}
