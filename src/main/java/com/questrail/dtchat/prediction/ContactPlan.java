package com.questrail.dtchat.prediction;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Nodes and contacts read from a contact plan file.
 */
public record ContactPlan(Set<String> nodes, List<Contact> contacts)
{
    public ContactPlan {
        nodes = Set.copyOf(Objects.requireNonNull(nodes, "nodes"));
        contacts = List.copyOf(Objects.requireNonNull(contacts, "contacts"));
    }
}
