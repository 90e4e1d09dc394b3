package com.example.merchant.model;

public record CustomerInfo(String name, String email, String phone) {
}
