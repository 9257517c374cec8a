package com.collegeportal.backend.modules.hod.presentation;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.hod.application.HodSuccessionService;
import com.collegeportal.backend.modules.hod.presentation.dto.HeadOfDepartmentResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DepartmentHodController {

    private final HodSuccessionService hodSuccessionService;

    public DepartmentHodController(HodSuccessionService hodSuccessionService) {
        this.hodSuccessionService = hodSuccessionService;
    }

    @GetMapping("/departments/{department}/hod")
    public ResponseEntity<HeadOfDepartmentResponse> currentHod(@PathVariable("department") String department) {
        return ResponseEntity.ok(hodSuccessionService.currentHod(
                SecurityUtils.currentActor(),
                DepartmentParam.parse(department)
        ));
    }
}
