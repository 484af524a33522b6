package com.hubhrms.onboarding.controller;

import com.hubhrms.common.dto.ApiResponse;
import com.hubhrms.onboarding.dto.ExceptionResponse;
import com.hubhrms.onboarding.dto.ResolveExceptionRequest;
import com.hubhrms.onboarding.service.WorkflowExceptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/onboarding/exceptions")
@RequiredArgsConstructor
public class WorkflowExceptionController {

    private final WorkflowExceptionService exceptionService;

    /**
     * 열린 예외 목록 (대시보드 폴링용)
     */
    @GetMapping("/open")
    public ApiResponse<List<ExceptionResponse>> listOpenExceptions() {
        return ApiResponse.success(exceptionService.listOpenExceptions().stream()
                .map(ExceptionResponse::from)
                .toList());
    }

    /**
     * 예외 해결 - 이미 해결된 예외에 다시 호출해도 오류 없이 기존 해결 정보를 돌려준다
     */
    @PostMapping("/{exceptionId}/resolve")
    public ApiResponse<ExceptionResponse> resolveException(@PathVariable UUID exceptionId,
                                                           @Valid @RequestBody ResolveExceptionRequest request) {
        return ApiResponse.success(ExceptionResponse.from(
                exceptionService.resolveException(exceptionId, request.resolvedBy(), request.resolutionNotes())));
    }
}
