package com.example.cleanersched.site;

import com.example.cleanersched.common.ApiResponse;
import com.example.cleanersched.roster.Clearance;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/sites")
public class SiteController {

    private static final Logger logger = LoggerFactory.getLogger(SiteController.class);
    private final SiteRepository siteRepository;

    public SiteController(SiteRepository siteRepository) {
        this.siteRepository = siteRepository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Site>>> getAllSites() {
        return ResponseEntity.ok(ApiResponse.success("現場一覧を取得しました", siteRepository.findAllByOrderByIdAsc()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Site>> createSite(@Valid @RequestBody SiteRequest request) {
        String client = request.clientName().trim();
        String siteName = request.siteName().trim();
        if (siteRepository.findByClientNameAndSiteName(client, siteName).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.failure("同じ顧客・現場が既に登録されています"));
        }
        Site site = new Site(client, siteName, request.requiredClearance());
        site.setAddress(request.address());
        Site saved = siteRepository.save(site);
        logger.info("現場を登録しました: {} / {} 要求={}", client, siteName, saved.getRequiredClearance());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("現場を登録しました", saved));
    }

    @PutMapping("/{id}/clearance")
    public ResponseEntity<ApiResponse<Site>> updateClearance(@PathVariable Long id, @RequestBody ClearanceRequest request) {
        Optional<Site> existing = siteRepository.findById(id);
        if (existing.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("現場が見つかりません"));
        }
        Site site = existing.get();
        site.setRequiredClearance(request == null ? null : request.requiredClearance());
        return ResponseEntity.ok(ApiResponse.success("要求クリアランスを更新しました", siteRepository.save(site)));
    }

    public record SiteRequest(
            @NotBlank(message = "顧客名は必須です") String clientName,
            @NotBlank(message = "現場名は必須です") String siteName,
            Clearance requiredClearance,
            String address) {}

    public record ClearanceRequest(Clearance requiredClearance) {}
}
