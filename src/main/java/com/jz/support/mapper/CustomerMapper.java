package com.jz.support.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.support.domain.entity.Customer;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface CustomerMapper extends BaseMapper<Customer> {

    /** 导入数据里的邮箱大小写不统一，按小写比对；入参须已转小写 */
    @Select("""
        SELECT * FROM customers
          WHERE lower(email) = #{email}
          LIMIT 1
    """)
    Customer selectByEmail(@Param("email") String email);
}
