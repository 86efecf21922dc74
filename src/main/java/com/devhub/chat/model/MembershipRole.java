package com.devhub.chat.model;

public enum MembershipRole {
    ADMIN,
    MEMBER
}
