package dev.vankka.supportdesk.discord;

import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.ticket.NotificationDelivery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.User;

@Slf4j
@RequiredArgsConstructor
public class JdaNotificationDelivery implements NotificationDelivery {

    private final JDA jda;

    @Override
    public void notify(String userRef, OutboundMessage message) {
        jda.retrieveUserById(userRef)
                .flatMap(User::openPrivateChannel)
                .flatMap(channel -> channel.sendMessage(JdaMessages.create(message)))
                .queue(
                        sent -> log.debug("Sent direct message to {}", userRef),
                        error -> log.warn("Couldn't send a direct message to {}: {}", userRef, error.getMessage())
                );
    }
}
