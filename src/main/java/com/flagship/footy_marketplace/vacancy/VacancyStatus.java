package com.flagship.footy_marketplace.vacancy;

public enum VacancyStatus {
    DRAFT,
    ACTIVE,
    CLOSED
}
