package com.example.cleanersched.roster;

import com.example.cleanersched.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/workers")
public class WorkerController {

    private static final Logger logger = LoggerFactory.getLogger(WorkerController.class);
    private final WorkerRepository workerRepository;

    public WorkerController(WorkerRepository workerRepository) {
        this.workerRepository = workerRepository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Worker>>> getAllWorkers() {
        return ResponseEntity.ok(ApiResponse.success("清掃員一覧を取得しました", workerRepository.findAllByOrderByIdAsc()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Worker>> createWorker(@Valid @RequestBody WorkerRequest request) {
        String name = request.name().trim();
        if (workerRepository.findByName(name).isPresent()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.failure("同名の清掃員が既に存在します"));
        }
        Worker worker = new Worker(name, Clearance.orLow(request.clearance()), request.active() == null || request.active());
        Worker saved = workerRepository.save(worker);
        logger.info("清掃員を登録しました: {} ({})", saved.getName(), saved.getClearance());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("清掃員を登録しました", saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Worker>> updateWorker(@PathVariable Long id, @Valid @RequestBody WorkerRequest request) {
        Optional<Worker> existing = workerRepository.findById(id);
        if (existing.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("清掃員が見つかりません"));
        }
        Worker worker = existing.get();
        // 名前は割り当てから参照されるため変更しない
        if (request.clearance() != null) worker.setClearance(request.clearance());
        if (request.active() != null) worker.setActive(request.active());
        return ResponseEntity.ok(ApiResponse.success("清掃員を更新しました", workerRepository.save(worker)));
    }

    public record WorkerRequest(
            @NotBlank(message = "清掃員名は必須です")
            @Size(max = 50, message = "清掃員名は50文字以下で入力してください") String name,
            Clearance clearance,
            Boolean active) {}
}
