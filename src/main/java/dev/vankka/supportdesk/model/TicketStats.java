package dev.vankka.supportdesk.model;

import lombok.Value;

import java.util.Map;

@Value
public class TicketStats {

    public static final String UNCATEGORIZED = "Uncategorized";

    long total;
    long open;
    long closed;
    long archived;
    Map<String, Long> perCategory;
}
