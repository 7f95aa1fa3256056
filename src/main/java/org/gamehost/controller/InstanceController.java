package org.gamehost.controller;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.dto.ApiResponse;
import org.gamehost.dto.CreateInstanceRequest;
import org.gamehost.dto.InstanceInfo;
import org.gamehost.dto.InstanceStatusSnapshot;
import org.gamehost.dto.ProvisioningResult;
import org.gamehost.entity.InstanceStatus;
import org.gamehost.security.TokenAuthenticator;
import org.gamehost.service.InstanceLifecycleService;
import org.gamehost.service.InstanceService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 游戏实例管理 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/instances")
public class InstanceController {
    
    @Autowired
    private InstanceService instanceService;
    
    @Autowired
    private InstanceLifecycleService lifecycleService;
    
    @Autowired
    private TokenAuthenticator tokenAuthenticator;
    
    /**
     * 创建实例
     * POST /api/instances
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ProvisioningResult>> createInstance(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody CreateInstanceRequest request) {
        String userId = tokenAuthenticator.resolveFromHeader(authorization);
        log.info("创建实例请求: userId={}, name={}, memory={}GB", userId, request.getName(), request.getMemory());
        ProvisioningResult result = instanceService.createInstance(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(result, "实例创建成功"));
    }
    
    /**
     * 当前用户的实例列表
     * GET /api/instances
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<InstanceInfo>>> listInstances(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String userId = tokenAuthenticator.resolveFromHeader(authorization);
        return ResponseEntity.ok(ApiResponse.success(instanceService.listInstances(userId)));
    }
    
    /**
     * GET /api/instances/{instanceId}
     */
    @GetMapping("/{instanceId}")
    public ResponseEntity<ApiResponse<InstanceInfo>> getInstance(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String instanceId) {
        String userId = tokenAuthenticator.resolveFromHeader(authorization);
        return ResponseEntity.ok(ApiResponse.success(instanceService.getInstance(userId, instanceId)));
    }
    
    /**
     * 实时状态
     * GET /api/instances/{instanceId}/status
     */
    @GetMapping("/{instanceId}/status")
    public ResponseEntity<ApiResponse<InstanceStatusSnapshot>> getStatus(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String instanceId) {
        instanceService.requireOwned(tokenAuthenticator.resolveFromHeader(authorization), instanceId);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.getStatus(instanceId)));
    }
    
    /**
     * 最近日志
     * GET /api/instances/{instanceId}/logs?tail=100
     */
    @GetMapping("/{instanceId}/logs")
    public ResponseEntity<ApiResponse<List<String>>> getLogs(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String instanceId,
            @RequestParam(defaultValue = "100") int tail) {
        instanceService.requireOwned(tokenAuthenticator.resolveFromHeader(authorization), instanceId);
        return ResponseEntity.ok(ApiResponse.success(lifecycleService.getLogBuffer(instanceId, tail)));
    }
    
    /**
     * 停止实例
     * POST /api/instances/{instanceId}/stop
     */
    @PostMapping("/{instanceId}/stop")
    public ResponseEntity<ApiResponse<InstanceStatus>> stopInstance(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String instanceId,
            @RequestParam(required = false) Integer graceSeconds) {
        instanceService.requireOwned(tokenAuthenticator.resolveFromHeader(authorization), instanceId);
        log.info("停止实例: instanceId={}", instanceId);
        InstanceStatus status = lifecycleService.stop(instanceId, graceSeconds);
        return ResponseEntity.ok(ApiResponse.success(status, "实例停止成功"));
    }
    
    /**
     * 重启实例
     * POST /api/instances/{instanceId}/restart
     */
    @PostMapping("/{instanceId}/restart")
    public ResponseEntity<ApiResponse<InstanceStatus>> restartInstance(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String instanceId) {
        instanceService.requireOwned(tokenAuthenticator.resolveFromHeader(authorization), instanceId);
        log.info("重启实例: instanceId={}", instanceId);
        InstanceStatus status = lifecycleService.restart(instanceId).getStatus();
        return ResponseEntity.ok(ApiResponse.success(status, "实例重启成功"));
    }
    
    /**
     * 销毁实例
     * DELETE /api/instances/{instanceId}?purge=false
     */
    @DeleteMapping("/{instanceId}")
    public ResponseEntity<ApiResponse<InstanceStatus>> destroyInstance(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String instanceId,
            @RequestParam(defaultValue = "false") boolean purge) {
        instanceService.requireOwned(tokenAuthenticator.resolveFromHeader(authorization), instanceId);
        log.info("销毁实例: instanceId={}, purge={}", instanceId, purge);
        InstanceStatus status = lifecycleService.destroy(instanceId, purge);
        return ResponseEntity.ok(ApiResponse.success(status, "实例销毁成功"));
    }
}
