package com.meetpoll.service;

import com.meetpoll.domain.model.Contact;

import java.util.UUID;

public record ContactView(UUID id, String name, String email) {

    static ContactView of(Contact contact) {
        return new ContactView(contact.getId(), contact.getName(), contact.getEmail());
    }
}
