package com.example.connect.web.dto;

import java.util.List;

public record ProvidersResponse<T>(List<T> providers) {
}
