package com.embedded.testgen;

/**
 * Small C project used across tests: {@code sensor.c} calls {@code adc_read}, which {@code adc.c} owns.
 */
public final class SampleSources {

    public static final String ADC_C = """
            #include "adc.h"

            int adc_read(int channel)
            {
                return channel * 4;
            }
            """;

    public static final String SENSOR_C = """
            #include "adc.h"

            int scale_reading(int raw)
            {
                return raw / 4;
            }

            int sensor_read_scaled(int channel)
            {
                return scale_reading(adc_read(channel));
            }
            """;

    public static final String MAIN_C = """
            #include <stdio.h>

            int main(void)
            {
                printf("%d\\n", sensor_read_scaled(1));
                return 0;
            }
            """;

    /** A test for sensor.c that passes every default check. */
    public static final String SENSOR_TEST = """
            /* test_sensor.c - Auto-generated Unity Tests */
            #include "unity.h"
            #include "adc.h"
            #include <string.h>

            typedef struct { int return_value; int call_count; int last_channel; } stub_adc_read_t;
            static stub_adc_read_t stub_adc_read;

            int adc_read(int channel)
            {
                stub_adc_read.call_count++;
                stub_adc_read.last_channel = channel;
                return stub_adc_read.return_value;
            }

            void setUp(void)
            {
                memset(&stub_adc_read, 0, sizeof(stub_adc_read));
            }

            void tearDown(void)
            {
                memset(&stub_adc_read, 0, sizeof(stub_adc_read));
            }

            void test_scale_reading_mid_range(void)
            {
                TEST_ASSERT_EQUAL_INT(100, scale_reading(400));
            }

            void test_scale_reading_zero(void)
            {
                TEST_ASSERT_EQUAL_INT(0, scale_reading(0));
            }

            void test_sensor_read_scaled_uses_adc(void)
            {
                stub_adc_read.return_value = 400;
                TEST_ASSERT_EQUAL_INT(100, sensor_read_scaled(2));
                TEST_ASSERT_EQUAL_INT(1, stub_adc_read.call_count);
            }

            int main(void)
            {
                UNITY_BEGIN();
                RUN_TEST(test_scale_reading_mid_range);
                RUN_TEST(test_scale_reading_zero);
                RUN_TEST(test_sensor_read_scaled_uses_adc);
                return UNITY_END();
            }
            """;

    /** {@link #SENSOR_TEST} without the Unity include. */
    public static final String SENSOR_TEST_WITHOUT_UNITY = SENSOR_TEST.replace("#include \"unity.h\"\n", "");

    private SampleSources() {
    }
}
