package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MessageTemplateUpdate {

    String welcomeMessage;
    String closeMessage;
    Boolean includeSupportTeam;
}
