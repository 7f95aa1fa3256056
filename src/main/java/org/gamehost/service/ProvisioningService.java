package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.dto.EndpointAssignment;
import org.gamehost.dto.ProvisioningResult;
import org.gamehost.entity.GameInstance;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * 预配服务：端口、地址、凭据，在任何容器存在之前完成
 */
@Slf4j
@Service
public class ProvisioningService {

    private final PortManagerService portManagerService;
    private final EndpointAssigner endpointAssigner;
    private final CredentialService credentialService;
    private final int rconPort;

    public ProvisioningService(PortManagerService portManagerService,
                               EndpointAssigner endpointAssigner,
                               CredentialService credentialService,
                               @Value("${gamehost.runtime.rcon-port:25575}") int rconPort) {
        this.portManagerService = portManagerService;
        this.endpointAssigner = endpointAssigner;
        this.credentialService = credentialService;
        this.rconPort = rconPort;
    }

    /**
     * 依次分配端口、地址、密码；后续步骤失败时释放已预留的端口
     */
    public ProvisioningResult provision(GameInstance instance) {
        log.info("开始预配: instanceId={}, userId={}", instance.getId(), instance.getOwnerId());
        Integer port = null;
        try {
            port = portManagerService.allocatePort(instance.getOwnerId(), instance.getId());
            EndpointAssignment endpoint = endpointAssigner.assignEndpointAddress();
            String secret = credentialService.generateSecret();

            ProvisioningResult result = new ProvisioningResult();
            result.setInstanceId(instance.getId());
            result.setPort(port);
            result.setIpAddress(endpoint.getAddress());
            result.setLocation(endpoint.getLabel());
            result.setRegion(endpoint.getRegion());
            result.setSecret(secret);
            result.setRconPort(rconPort);
            result.setProvisionedAt(LocalDateTime.now());

            log.info("预配完成: instanceId={}, port={}, address={}", instance.getId(), port, endpoint.getAddress());
            return result;
        } catch (RuntimeException e) {
            log.error("预配失败: instanceId={}", instance.getId(), e);
            if (port != null) {
                try {
                    portManagerService.releasePort(port, instance.getId());
                } catch (RuntimeException releaseError) {
                    e.addSuppressed(releaseError);
                }
            }
            throw e;
        }
    }
}
