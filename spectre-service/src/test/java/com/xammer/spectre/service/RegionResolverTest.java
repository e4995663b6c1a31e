package com.xammer.spectre.service;

import com.xammer.spectre.exception.RegionResolutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsResponse;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.Region;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RegionResolverTest {

    private AwsClientProvider clients;
    private Ec2Client ec2;
    private RegionResolver resolver;

    @BeforeEach
    void setUp() {
        clients = mock(AwsClientProvider.class);
        ec2 = mock(Ec2Client.class);
        when(clients.getDefaultRegion()).thenReturn("eu-central-1");
        when(clients.getEc2Client(anyString())).thenReturn(ec2);
        resolver = new RegionResolver(clients, new RetryExecutor(
                new RetryPolicy(2, Duration.ZERO, new TransientErrorClassifier()::isTransient)));
    }

    @Test
    void explicitRegions_areTrimmedAndDeduplicated() {
        List<String> regions = resolver.resolve(
                RegionSelection.explicit(Arrays.asList(" us-east-1", "eu-west-1", "us-east-1", "")));

        assertEquals(List.of("us-east-1", "eu-west-1"), regions);
        verifyNoInteractions(ec2);
    }

    @Test
    void explicitRegions_winOverAllRegions() {
        List<String> regions = resolver.resolve(new RegionSelection(List.of("ap-south-1"), true, null));

        assertEquals(List.of("ap-south-1"), regions);
        verifyNoInteractions(ec2);
    }

    @Test
    void allRegions_listsEnabledRegions() {
        when(ec2.describeRegions(any(DescribeRegionsRequest.class))).thenReturn(DescribeRegionsResponse.builder()
                .regions(Region.builder().regionName("us-east-1").build(),
                        Region.builder().regionName("eu-west-1").build())
                .build());

        List<String> regions = resolver.resolve(RegionSelection.allEnabled());

        assertEquals(List.of("us-east-1", "eu-west-1"), regions);
        verify(ec2).describeRegions(argThat((DescribeRegionsRequest r) -> Boolean.FALSE.equals(r.allRegions())));
    }

    @Test
    void allRegions_listingFailure_isSystemic() {
        when(ec2.describeRegions(any(DescribeRegionsRequest.class))).thenThrow(Ec2Exception.builder()
                .statusCode(403)
                .message("UnauthorizedOperation")
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("UnauthorizedOperation").build())
                .build());

        RegionResolutionException ex = assertThrows(RegionResolutionException.class,
                () -> resolver.resolve(RegionSelection.allEnabled()));

        assertTrue(ex.getMessage().startsWith("failed to list AWS regions"));
        verify(ec2, times(1)).describeRegions(any(DescribeRegionsRequest.class));
    }

    @Test
    void allRegions_emptyListing_isSystemic() {
        when(ec2.describeRegions(any(DescribeRegionsRequest.class)))
                .thenReturn(DescribeRegionsResponse.builder().build());

        assertThrows(RegionResolutionException.class, () -> resolver.resolve(RegionSelection.allEnabled()));
    }

    @Test
    void noSelection_usesDefaultRegion() {
        assertEquals(List.of("us-west-2"), resolver.resolve(RegionSelection.defaultOnly("us-west-2")));
        assertEquals(List.of("eu-central-1"), resolver.resolve(RegionSelection.defaultOnly(null)));
    }
}
