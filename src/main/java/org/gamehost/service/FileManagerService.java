package org.gamehost.service;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.config.RuntimeProperties;
import org.gamehost.exception.GameHostException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 实例持久化目录管理
 */
@Slf4j
@Service
public class FileManagerService {
    
    public static final String ERROR_CODE_STORAGE_FAILED = "STORAGE_FAILED";
    
    private static final int MAX_DELETE_RETRIES = 3;
    
    private final RuntimeProperties runtimeProperties;
    
    public FileManagerService(RuntimeProperties runtimeProperties) {
        this.runtimeProperties = runtimeProperties;
    }
    
    /**
     * 实例数据目录，按实例ID区分，重启和软删除后保留
     */
    public Path dataDirOf(String instanceId) {
        return Paths.get(runtimeProperties.getDataBasePath(), instanceId);
    }
    
    /**
     * 创建实例数据目录（已存在则直接复用）
     */
    public String prepareDataDir(String instanceId) {
        Path dataPath = dataDirOf(instanceId);
        try {
            Files.createDirectories(dataPath);
            log.info("实例数据目录就绪: {}", dataPath);
        } catch (IOException e) {
            log.error("创建实例数据目录失败: {}", dataPath, e);
            throw new GameHostException(ERROR_CODE_STORAGE_FAILED, "创建实例数据目录失败: " + dataPath, e);
        }
        return dataPath.toString();
    }
    
    /**
     * 删除目录（带重试机制）
     */
    public void deleteDirectory(Path directory) {
        if (!Files.exists(directory)) {
            log.info("目录不存在，跳过删除: {}", directory);
            return;
        }
        
        int retryCount = 0;
        while (true) {
            try {
                Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }
                    
                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                        if (exc != null) {
                            throw exc;
                        }
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
                log.info("删除目录成功: {}", directory);
                return;
            } catch (IOException e) {
                retryCount++;
                if (retryCount >= MAX_DELETE_RETRIES) {
                    log.error("删除目录失败，已达到最大重试次数: {}", directory, e);
                    throw new GameHostException(ERROR_CODE_STORAGE_FAILED, "删除目录失败: " + directory, e);
                }
                log.warn("删除目录失败，第{}次重试: {}", retryCount, directory);
                try {
                    Thread.sleep(500);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new GameHostException(ERROR_CODE_STORAGE_FAILED, "删除目录被中断: " + directory, ie);
                }
            }
        }
    }
}
