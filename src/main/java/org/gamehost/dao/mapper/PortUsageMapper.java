package org.gamehost.dao.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.gamehost.entity.PortUsage;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 端口使用 Mapper
 */
@Mapper
public interface PortUsageMapper extends BaseMapper<PortUsage> {
    
    /**
     * 范围内不可分配的端口：RESERVED / BOUND，或释放时间晚于 cutoff（隔离期内）
     */
    @Select("SELECT port FROM port_usage WHERE port BETWEEN #{min} AND #{max} "
        + "AND (status <> 'FREE' OR released_time > #{cutoff})")
    List<Integer> selectUnavailablePorts(@Param("min") int min,
                                         @Param("max") int max,
                                         @Param("cutoff") LocalDateTime cutoff);
    
    @Select("SELECT * FROM port_usage WHERE port BETWEEN #{min} AND #{max} AND status <> 'FREE'")
    List<PortUsage> selectHeldPorts(@Param("min") int min, @Param("max") int max);
    
    /**
     * 条件更新 FREE → RESERVED，返回 0 表示已被其他请求抢占
     */
    @Update("UPDATE port_usage SET status = 'RESERVED', instance_id = #{instanceId}, allocated_time = #{now} "
        + "WHERE port = #{port} AND status = 'FREE' AND (released_time IS NULL OR released_time <= #{cutoff})")
    int claimFreePort(@Param("port") int port,
                      @Param("instanceId") String instanceId,
                      @Param("now") LocalDateTime now,
                      @Param("cutoff") LocalDateTime cutoff);
    
    @Update("UPDATE port_usage SET status = 'BOUND' "
        + "WHERE port = #{port} AND instance_id = #{instanceId} AND status = 'RESERVED'")
    int markBound(@Param("port") int port, @Param("instanceId") String instanceId);
    
    /**
     * 只释放属于该实例的端口
     */
    @Update("UPDATE port_usage SET status = 'FREE', instance_id = NULL, released_time = #{now} "
        + "WHERE port = #{port} AND instance_id = #{instanceId} AND status <> 'FREE'")
    int release(@Param("port") int port,
                @Param("instanceId") String instanceId,
                @Param("now") LocalDateTime now);
}
