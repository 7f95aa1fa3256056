package org.gamehost.dao.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.gamehost.entity.GameInstance;

import java.util.List;

/**
 * 游戏实例 Mapper
 */
@Mapper
public interface GameInstanceMapper extends BaseMapper<GameInstance> {
    
    @Select("SELECT * FROM game_instance WHERE owner_id = #{ownerId} AND status <> 'DESTROYED' "
        + "ORDER BY created_time DESC")
    List<GameInstance> selectActiveByOwner(@Param("ownerId") String ownerId);
}
