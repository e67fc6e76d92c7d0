package com.rockspec.generator.cmake;

/**
 * CMake fragments the renderer is assembled from. Placeholders are
 * {@link String#format} arguments.
 */
final class CMakeTemplates {

    private CMakeTemplates() {
        // Constants only
    }

    static final String INDENT = "    ";

    static final String SCRIPT_EXTENSION = "lua";

    static final String PREAMBLE = """
            # Generated Cmake file begin
            cmake_minimum_required(VERSION 3.1)

            project(%s C CXX)

            find_package(Lua)

            ## INSTALL DEFAULTS (Relative to CMAKE_INSTALL_PREFIX)
            # Primary paths
            set(INSTALL_BIN bin CACHE PATH "Where to install binaries to.")
            set(INSTALL_LIB lib CACHE PATH "Where to install libraries to.")
            set(INSTALL_ETC etc CACHE PATH "Where to store configuration files")
            set(INSTALL_SHARE share CACHE PATH "Directory for shared data.")

            set(INSTALL_LMOD ${INSTALL_LIB}/lua CACHE PATH "Directory to install Lua modules.")
            set(INSTALL_CMOD ${INSTALL_LIB}/lua CACHE PATH "Directory to install Lua binary modules.")

            """;

    static final String FATAL_ERROR = """
            message(FATAL_ERROR "%s")

            """;

    static final String UNSUPPORTED_PLATFORM_CHECK = """
            if (%s)
                message(FATAL_ERROR "Unsupported platform (your platform was explicitly marked as not supported)")
            endif()

            """;

    static final String SUPPORTED_PLATFORM_CHECK = """
            if (%s)
                message(FATAL_ERROR "Unsupported platform (your platform is not in list of supported platforms)")
            endif()

            """;

    static final String SET_VARIABLE = "set(%s %s)\n";

    // Body must end with a newline
    static final String PLATFORM_BLOCK = """
            if (%s)
            %sendif()

            """;

    static final String INSTALL_COPY = """
            install(FILES ${BUILD_COPY_DIRECTORIES} DESTINATION ${CMAKE_INSTALL_PREFIX})
            install(DIRECTORY ${BUILD_INSTALL_LUA} DESTINATION ${INSTALL_LMOD})
            install(DIRECTORY ${BUILD_INSTALL_LIB} DESTINATION ${INSTALL_LIB})
            install(DIRECTORY ${BUILD_INSTALL_CONF} DESTINATION ${INSTALL_ETC})
            install(DIRECTORY ${BUILD_INSTALL_BIN} DESTINATION ${INSTALL_BIN})

            """;

    static final String INSTALL_SCRIPT_MODULE =
            "install(FILES ${%s_SOURCES} DESTINATION ${INSTALL_LMOD}/%s RENAME %s)\n";

    static final String NATIVE_MODULE = """
            add_library(%1$s ${%1$s_SOURCES})

            foreach(LIBRARY ${%1$s_LIBRARIES})
                find_library(${LIBRARY} ${LIBRARY} ${%1$s_LIBDIRS})
            endforeach(LIBRARY)

            target_include_directories(%1$s PRIVATE ${%1$s_INCDIRS})
            target_compile_definitions(%1$s PRIVATE ${%1$s_DEFINES})
            target_link_libraries(%1$s PRIVATE ${%1$s_LIBRARIES})
            install(TARGETS %1$s DESTINATION ${INSTALL_CMOD})

            """;
}
