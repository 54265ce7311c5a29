package dev.vankka.supportdesk.discord;

import dev.vankka.supportdesk.ticket.PrivilegeResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;

import java.util.Optional;
import java.util.Set;

/**
 * Staff are members with the Administrator or Manage Channels permission, or one of the configured admin roles.
 */
@Slf4j
@RequiredArgsConstructor
public class JdaPrivilegeResolver implements PrivilegeResolver {

    private final JDA jda;
    private final Set<String> adminRoleIds;

    @Override
    public boolean isElevated(String tenantId, String principalRef) {
        return member(tenantId, principalRef)
                .map(member -> member.hasPermission(Permission.ADMINISTRATOR)
                        || member.hasPermission(Permission.MANAGE_CHANNEL)
                        || member.getRoles().stream().anyMatch(role -> adminRoleIds.contains(role.getId())))
                .orElse(false);
    }

    @Override
    public boolean hasRole(String tenantId, String principalRef, String roleRef) {
        return member(tenantId, principalRef)
                .map(member -> member.getRoles().stream().anyMatch(role -> role.getId().equals(roleRef)))
                .orElse(false);
    }

    @Override
    public boolean isBot(String principalRef) {
        try {
            return jda.retrieveUserById(principalRef).complete().isBot();
        } catch (ErrorResponseException e) {
            log.debug("Could not resolve user {}: {}", principalRef, e.getMeaning());
            return false;
        }
    }

    private Optional<Member> member(String tenantId, String principalRef) {
        Guild guild = jda.getGuildById(tenantId);
        if (guild == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(guild.retrieveMemberById(principalRef).complete());
        } catch (ErrorResponseException e) {
            log.debug("Could not resolve member {} of guild {}: {}", principalRef, tenantId, e.getMeaning());
            return Optional.empty();
        }
    }
}
