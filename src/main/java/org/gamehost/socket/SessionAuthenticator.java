package org.gamehost.socket;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.dao.mapper.GameInstanceMapper;
import org.gamehost.entity.GameInstance;
import org.gamehost.entity.InstanceStatus;
import org.gamehost.exception.AuthorizationException;
import org.gamehost.exception.ContainerException;
import org.gamehost.security.TokenAuthenticator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 会话认证：校验令牌、实例归属和实例运行状态
 */
@Slf4j
@Component
public class SessionAuthenticator {
    
    private final TokenAuthenticator tokenAuthenticator;
    private final GameInstanceMapper gameInstanceMapper;
    
    public SessionAuthenticator(TokenAuthenticator tokenAuthenticator, GameInstanceMapper gameInstanceMapper) {
        this.tokenAuthenticator = tokenAuthenticator;
        this.gameInstanceMapper = gameInstanceMapper;
    }
    
    public SessionPrincipal authorize(String token, String instanceId, SessionKind kind) {
        String userId = tokenAuthenticator.resolveUserId(token);
        if (!StringUtils.hasText(instanceId)) {
            throw new AuthorizationException(AuthorizationException.ERROR_CODE_ACCESS_DENIED, "instanceId 参数必填");
        }
        
        GameInstance instance = gameInstanceMapper.selectById(instanceId);
        // 实例不存在与无权访问返回同一错误
        if (instance == null || !userId.equals(instance.getOwnerId())) {
            log.warn("拒绝会话: userId={}, instanceId={}, kind={}", userId, instanceId, kind);
            throw new AuthorizationException(AuthorizationException.ERROR_CODE_ACCESS_DENIED, "无权访问该实例");
        }
        if (instance.getStatus() != InstanceStatus.RUNNING || !StringUtils.hasText(instance.getContainerId())) {
            throw new ContainerException(ContainerException.ERROR_CODE_NOT_RUNNING,
                String.format("实例 %s 未运行，当前状态 %s", instanceId, instance.getStatus()));
        }
        return new SessionPrincipal(userId, instanceId, instance.getContainerId(), kind);
    }
}
