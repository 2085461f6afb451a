package com.jreinhal.scrubber.controller;

import com.jreinhal.scrubber.policy.PolicyEngine;
import com.jreinhal.scrubber.policy.PolicySet;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/policy"})
public class PolicyController {
    private final PolicyEngine policyEngine;

    public PolicyController(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    @PostMapping(value={"/reload"})
    public Map<String, Object> reload() {
        PolicySet set = this.policyEngine.reload();
        Map<String, String> problems = new TreeMap<String, String>();
        set.problems().forEach((tier, reason) -> problems.put(tier.name(), reason));
        return Map.of("version", set.version(), "problems", problems);
    }
}
