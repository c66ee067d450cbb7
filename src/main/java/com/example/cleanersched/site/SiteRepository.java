package com.example.cleanersched.site;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SiteRepository extends JpaRepository<Site, Long> {

    Optional<Site> findByClientNameAndSiteName(String clientName, String siteName);

    List<Site> findAllByOrderByIdAsc();
}
