package com.syncnest.accountservice.entity;

public enum AccountRole {
    ROLE_USER,
    ROLE_ADMIN
}
