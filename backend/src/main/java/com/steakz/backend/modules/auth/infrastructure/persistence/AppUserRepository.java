package com.steakz.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    @Query("select u from AppUser u where lower(u.email) = lower(:email)")
    Optional<AppUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(u) > 0 then true else false end from AppUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select u
              from AppUser u
             where u.branchId = :branchId
               and u.role in :roles
             order by u.createdAt desc, u.id desc
            """)
    List<AppUser> findByBranchAndRoles(@Param("branchId") Long branchId, @Param("roles") Collection<Role> roles);
}
